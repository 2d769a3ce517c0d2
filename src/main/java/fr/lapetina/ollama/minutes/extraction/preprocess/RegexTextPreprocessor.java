package fr.lapetina.ollama.minutes.extraction.preprocess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based transcript cleaner.
 *
 * Steps, in order: line-break and whitespace normalisation, removal of bracketed
 * transcription markers and timestamps, optional filler/repetition/speaker-label removal,
 * contraction expansion, punctuation normalisation, segmentation.
 */
public final class RegexTextPreprocessor implements TextPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(RegexTextPreprocessor.class);

    private static final int MIN_SEGMENT_LENGTH = 10;

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f]{2,}");
    private static final Pattern TRANSCRIPTION_MARKERS = Pattern.compile("\\[.*?]|\\(.*?\\)");
    private static final Pattern TIMESTAMPS = Pattern.compile("\\d{1,2}:\\d{2}(?::\\d{2})?(?:\\s*[AP]M)?");
    private static final Pattern FILLER_WORDS = Pattern.compile(
            "\\b(um|uh|ah|er|hmm|you know|sort of|kind of)\\b,?", Pattern.CASE_INSENSITIVE);
    private static final Pattern REPEATED_WORDS = Pattern.compile("\\b(\\w+)(\\s+\\1\\b)+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPEAKER_LABELS = Pattern.compile("^(Speaker\\s*\\d+|[A-Z][a-z]+):\\s*", Pattern.MULTILINE);
    private static final Pattern INTERRUPTIONS = Pattern.compile("-{2,}|\\.{3,}|…");
    private static final Pattern REPEATED_PUNCTUATION = Pattern.compile("([.!?])\\1+");
    private static final Pattern SENTENCE_SPACING = Pattern.compile("([.!?])[ \\t]*([A-Z])");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("[ \\t]+([,.!?])");

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?]+\\s+");
    private static final Pattern PARAGRAPH_BOUNDARY = Pattern.compile("\\n\\s*\\n");
    private static final Pattern TOPIC_MARKERS = Pattern.compile(
            "\\b(next|moving on|agenda|topic|item|discussion)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ACTION_MARKERS = Pattern.compile(
            "\\b(action|task|todo|follow.?up|assign)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DECISION_MARKERS = Pattern.compile(
            "\\b(decide|decision|agree|resolved|conclusion)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAMES = Pattern.compile("\\b[A-Z][a-z]+ [A-Z][a-z]+\\b");
    private static final Pattern EMAILS = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private static final Map<Pattern, String> REPLACEMENTS = buildReplacements();

    private static Map<Pattern, String> buildReplacements() {
        Map<String, String> words = new LinkedHashMap<>();
        words.put("gonna", "going to");
        words.put("wanna", "want to");
        words.put("gotta", "got to");
        words.put("shoulda", "should have");
        words.put("coulda", "could have");
        words.put("wouldve", "would have");
        words.put("don't", "do not");
        words.put("won't", "will not");
        words.put("can't", "cannot");
        words.put("isn't", "is not");
        words.put("aren't", "are not");
        words.put("wasn't", "was not");
        words.put("weren't", "were not");
        words.put("haven't", "have not");
        words.put("hasn't", "has not");
        words.put("hadn't", "had not");
        words.put("shouldn't", "should not");
        words.put("wouldn't", "would not");
        words.put("couldn't", "could not");
        Map<Pattern, String> patterns = new LinkedHashMap<>();
        words.forEach((from, to) -> patterns.put(
                Pattern.compile("\\b" + Pattern.quote(from) + "\\b", Pattern.CASE_INSENSITIVE),
                Matcher.quoteReplacement(to)));
        return patterns;
    }

    @Override
    public PreprocessedText preprocess(String rawText, PreprocessingOptions options) {
        if (rawText == null || rawText.isBlank()) {
            throw new PreprocessingException("Transcript is empty");
        }
        PreprocessingOptions opts = options != null ? options : PreprocessingOptions.defaults();
        log.info("Starting text preprocessing: length={}", rawText.length());

        String text = initialCleaning(rawText);
        text = removeNoise(text, opts);
        text = normalize(text, opts);
        if (text.isBlank()) {
            throw new PreprocessingException("Transcript has no content after cleaning");
        }

        List<String> segments = segment(text, opts.segmentBy());
        PreprocessedText result = new PreprocessedText(
                rawText,
                text,
                segments,
                metadata(rawText, text),
                stats(rawText, text, segments)
        );
        log.info("Preprocessing completed: originalLength={}, cleanedLength={}, segments={}",
                rawText.length(), text.length(), segments.size());
        return result;
    }

    private static String initialCleaning(String text) {
        String cleaned = text.replace("\r\n", "\n").replace('\r', '\n');
        cleaned = TRANSCRIPTION_MARKERS.matcher(cleaned).replaceAll("");
        cleaned = TIMESTAMPS.matcher(cleaned).replaceAll("");
        cleaned = HORIZONTAL_WHITESPACE.matcher(cleaned).replaceAll(" ");
        return cleaned.strip();
    }

    private static String removeNoise(String text, PreprocessingOptions options) {
        String cleaned = text;
        if (options.removeSpeakerLabels()) {
            cleaned = SPEAKER_LABELS.matcher(cleaned).replaceAll("");
        }
        if (options.removeFillers()) {
            cleaned = FILLER_WORDS.matcher(cleaned).replaceAll("");
        }
        if (options.removeRepetitions()) {
            cleaned = REPEATED_WORDS.matcher(cleaned).replaceAll("$1");
        }
        return INTERRUPTIONS.matcher(cleaned).replaceAll(".");
    }

    private static String normalize(String text, PreprocessingOptions options) {
        String cleaned = text;
        if (options.expandContractions()) {
            for (Map.Entry<Pattern, String> replacement : REPLACEMENTS.entrySet()) {
                cleaned = replacement.getKey().matcher(cleaned).replaceAll(replacement.getValue());
            }
        }
        cleaned = REPEATED_PUNCTUATION.matcher(cleaned).replaceAll("$1");
        cleaned = SENTENCE_SPACING.matcher(cleaned).replaceAll("$1 $2");
        cleaned = HORIZONTAL_WHITESPACE.matcher(cleaned).replaceAll(" ");
        cleaned = SPACE_BEFORE_PUNCTUATION.matcher(cleaned).replaceAll("$1");
        return cleaned.lines().map(String::strip).reduce((a, b) -> a + "\n" + b).orElse("").strip();
    }

    static List<String> segment(String text, PreprocessingOptions.SegmentMode mode) {
        List<String> raw = switch (mode) {
            case SENTENCE -> List.of(SENTENCE_BOUNDARY.split(text));
            case PARAGRAPH -> List.of(PARAGRAPH_BOUNDARY.split(text));
            case TOPIC -> segmentByTopic(text);
        };
        List<String> segments = new ArrayList<>();
        for (String s : raw) {
            String trimmed = s.strip();
            if (trimmed.length() > MIN_SEGMENT_LENGTH) {
                segments.add(trimmed);
            }
        }
        return segments;
    }

    private static List<String> segmentByTopic(String text) {
        Matcher matcher = TOPIC_MARKERS.matcher(text);
        List<String> segments = new ArrayList<>();
        int start = 0;
        boolean found = false;
        while (matcher.find()) {
            found = true;
            if (start < matcher.start()) {
                segments.add(text.substring(start, matcher.start()));
            }
            start = matcher.start();
        }
        if (!found) {
            return List.of(PARAGRAPH_BOUNDARY.split(text));
        }
        segments.add(text.substring(start));
        return segments;
    }

    private static Map<String, Object> metadata(String original, String cleaned) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("processing_timestamp", Instant.now().toString());
        metadata.put("original_length", original.length());
        metadata.put("cleaned_length", cleaned.length());
        metadata.put("compression_ratio", (double) cleaned.length() / original.length());

        Map<String, Object> entities = new LinkedHashMap<>();
        entities.put("names", List.copyOf(findAll(NAMES, cleaned)));
        entities.put("email_addresses", List.copyOf(findAll(EMAILS, cleaned)));
        metadata.put("entities", entities);

        Map<String, Integer> markers = new LinkedHashMap<>();
        markers.put("topic_markers", count(TOPIC_MARKERS, cleaned));
        markers.put("action_markers", count(ACTION_MARKERS, cleaned));
        markers.put("decision_markers", count(DECISION_MARKERS, cleaned));
        metadata.put("content_markers", markers);
        return metadata;
    }

    private static Map<String, Integer> stats(String original, String cleaned, List<String> segments) {
        int originalWords = wordCount(original);
        int cleanedWords = wordCount(cleaned);
        int segmentChars = segments.stream().mapToInt(String::length).sum();
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("original_chars", original.length());
        stats.put("cleaned_chars", cleaned.length());
        stats.put("chars_removed", original.length() - cleaned.length());
        stats.put("original_words", originalWords);
        stats.put("cleaned_words", cleanedWords);
        stats.put("words_removed", originalWords - cleanedWords);
        stats.put("segments_created", segments.size());
        stats.put("avg_segment_length", segments.isEmpty() ? 0 : segmentChars / segments.size());
        return stats;
    }

    private static Set<String> findAll(Pattern pattern, String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return found;
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }

    private static int wordCount(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    }
}
