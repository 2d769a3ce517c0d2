package fr.lapetina.ollama.minutes.domain.minutes;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decision taken during the meeting.
 */
public record Decision(
        String decision,
        String rationale,
        String impact,
        @JsonProperty("responsible_party") String responsibleParty,
        @JsonProperty("implementation_date") String implementationDate
) {
    public boolean hasDecision() {
        return decision != null && !decision.isBlank();
    }
}
