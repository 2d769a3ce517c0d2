package fr.lapetina.ollama.minutes.domain.minutes;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Meeting attendee. {@code present} defaults to true when the model omits it.
 */
public record Attendee(
        String name,
        String role,
        String organization,
        String email,
        Boolean present
) {
    public Attendee {
        present = present != null ? present : Boolean.TRUE;
    }

    @JsonIgnore
    public boolean isNamed() {
        return name != null && !name.isBlank();
    }
}
