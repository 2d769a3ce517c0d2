package fr.lapetina.ollama.minutes.extraction.preprocess;

import java.util.List;
import java.util.Map;

/**
 * Output of a {@link TextPreprocessor}.
 *
 * @param metadata descriptive data about the text (lengths, marker counts, entities)
 * @param stats    character, word and segment counts before and after cleaning
 */
public record PreprocessedText(
        String originalText,
        String cleanedText,
        List<String> segments,
        Map<String, Object> metadata,
        Map<String, Integer> stats
) {
    public PreprocessedText {
        segments = segments != null ? List.copyOf(segments) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        stats = stats != null ? Map.copyOf(stats) : Map.of();
    }
}
