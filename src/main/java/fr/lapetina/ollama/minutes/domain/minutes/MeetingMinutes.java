package fr.lapetina.ollama.minutes.domain.minutes;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Complete structured minutes of one meeting. Lists are never null.
 */
public record MeetingMinutes(
        @JsonProperty("basic_info") MeetingBasicInfo basicInfo,
        List<Attendee> attendees,
        List<DiscussionTopic> agenda,
        @JsonProperty("action_items") List<ActionItem> actionItems,
        List<Decision> decisions,
        @JsonProperty("key_outcomes") List<String> keyOutcomes
) {
    public MeetingMinutes {
        basicInfo = basicInfo != null ? basicInfo : MeetingBasicInfo.empty();
        attendees = attendees != null ? List.copyOf(attendees) : List.of();
        agenda = agenda != null ? List.copyOf(agenda) : List.of();
        actionItems = actionItems != null ? List.copyOf(actionItems) : List.of();
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
        keyOutcomes = keyOutcomes != null ? List.copyOf(keyOutcomes) : List.of();
    }
}
