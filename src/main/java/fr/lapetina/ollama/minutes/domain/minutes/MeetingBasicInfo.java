package fr.lapetina.ollama.minutes.domain.minutes;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Basic meeting information. Every field is optional.
 */
public record MeetingBasicInfo(
        String title,
        String date,
        String time,
        String duration,
        String location,
        @JsonProperty("meeting_type") String meetingType,
        String organizer
) {
    public static MeetingBasicInfo empty() {
        return new MeetingBasicInfo(null, null, null, null, null, null, null);
    }

    /**
     * A basic info block identifies the meeting when it has a title or a meeting type.
     */
    @JsonIgnore
    public boolean isIdentified() {
        return hasText(title) || hasText(meetingType);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
