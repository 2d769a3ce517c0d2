package fr.lapetina.ollama.minutes.extraction.preprocess;

/**
 * Turns a raw transcript into cleaned text for extraction.
 *
 * Implementations are pure functions of their input and thread-safe.
 */
public interface TextPreprocessor {

    /**
     * @throws PreprocessingException if the transcript cannot be used
     */
    PreprocessedText preprocess(String rawText, PreprocessingOptions options);
}
