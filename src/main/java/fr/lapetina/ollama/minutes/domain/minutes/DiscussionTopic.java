package fr.lapetina.ollama.minutes.domain.minutes;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Agenda item or discussion topic.
 */
public record DiscussionTopic(
        String title,
        String description,
        String presenter,
        String duration,
        @JsonProperty("key_points") List<String> keyPoints
) {
    public DiscussionTopic {
        keyPoints = keyPoints != null
                ? keyPoints.stream().filter(Objects::nonNull).toList()
                : List.of();
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
