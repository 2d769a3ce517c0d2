package fr.lapetina.ollama.minutes.extraction.preprocess;

/**
 * Switches for the cleaning steps of {@link RegexTextPreprocessor}.
 */
public record PreprocessingOptions(
        boolean removeFillers,
        boolean removeRepetitions,
        boolean removeSpeakerLabels,
        boolean expandContractions,
        SegmentMode segmentBy
) {
    public enum SegmentMode {
        PARAGRAPH,
        SENTENCE,
        TOPIC
    }

    public PreprocessingOptions {
        segmentBy = segmentBy != null ? segmentBy : SegmentMode.PARAGRAPH;
    }

    public static PreprocessingOptions defaults() {
        return new PreprocessingOptions(true, true, false, true, SegmentMode.PARAGRAPH);
    }
}
