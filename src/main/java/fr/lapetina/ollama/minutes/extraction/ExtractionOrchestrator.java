package fr.lapetina.ollama.minutes.extraction;

import fr.lapetina.ollama.minutes.domain.minutes.ActionItem;
import fr.lapetina.ollama.minutes.domain.minutes.Attendee;
import fr.lapetina.ollama.minutes.domain.minutes.Decision;
import fr.lapetina.ollama.minutes.domain.minutes.DiscussionTopic;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingBasicInfo;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingMinutes;
import fr.lapetina.ollama.minutes.domain.model.GenerationRequest;
import fr.lapetina.ollama.minutes.extraction.preprocess.PreprocessedText;
import fr.lapetina.ollama.minutes.extraction.preprocess.PreprocessingOptions;
import fr.lapetina.ollama.minutes.extraction.preprocess.TextPreprocessor;
import fr.lapetina.ollama.minutes.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ollama.minutes.infrastructure.pool.ConnectionPoolManager;
import fr.lapetina.ollama.minutes.infrastructure.recovery.EndpointProbeRecoveryAction;
import fr.lapetina.ollama.minutes.infrastructure.recovery.RetryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Extracts structured minutes from a transcript.
 *
 * The transcript is preprocessed, then every {@link ExtractionField} is extracted as an
 * independent task on the worker pool: one LLM call through the pool manager's failover,
 * wrapped in the retry engine. A field that still fails gets its typed default and fails
 * validation; the other fields are unaffected. Only a preprocessing failure, an interrupt
 * of the calling thread or a failure to schedule the tasks fails the run as a whole.
 *
 * Interrupting the calling thread cancels every field task; each task releases its
 * endpoint slot as it unwinds.
 */
public final class ExtractionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    public static final String MDC_EXTRACTION_ID = "extractionId";
    public static final String MDC_FIELD = "field";

    private final TextPreprocessor preprocessor;
    private final ConnectionPoolManager poolManager;
    private final RetryEngine retryEngine;
    private final FieldParser parser;
    private final MinutesValidator validator;
    private final ConfidenceScorer scorer;
    private final MetricsRegistry metrics;
    private final ExecutorService executor;
    private final String defaultPoolId;
    private final int defaultTextWindow;
    private final Duration defaultRunTimeout;

    public ExtractionOrchestrator(
            TextPreprocessor preprocessor,
            ConnectionPoolManager poolManager,
            RetryEngine retryEngine,
            FieldParser parser,
            MinutesValidator validator,
            ConfidenceScorer scorer,
            MetricsRegistry metrics,
            ExecutorService executor,
            String defaultPoolId,
            int defaultTextWindow,
            Duration defaultRunTimeout
    ) {
        this.preprocessor = preprocessor;
        this.poolManager = poolManager;
        this.retryEngine = retryEngine;
        this.parser = parser;
        this.validator = validator;
        this.scorer = scorer;
        this.metrics = metrics;
        this.executor = executor;
        this.defaultPoolId = defaultPoolId;
        this.defaultTextWindow = defaultTextWindow;
        this.defaultRunTimeout = defaultRunTimeout != null ? defaultRunTimeout : Duration.ZERO;
    }

    public ExtractionResult extract(String transcript) {
        return extract(transcript, PreprocessingOptions.defaults(), ExtractionOptions.defaults());
    }

    /**
     * Runs one extraction. Never throws; failures are reported through the result status.
     */
    public ExtractionResult extract(
            String transcript,
            PreprocessingOptions preprocessingOptions,
            ExtractionOptions extractionOptions
    ) {
        ExtractionOptions options = extractionOptions != null ? extractionOptions : ExtractionOptions.defaults();
        String extractionId = UUID.randomUUID().toString();
        long start = System.nanoTime();
        MDC.put(MDC_EXTRACTION_ID, extractionId);
        try {
            log.info("Starting meeting minutes extraction: extractionId={}, textLength={}",
                    extractionId, transcript != null ? transcript.length() : 0);
            ExtractionResult result = run(extractionId, transcript, preprocessingOptions, options, start);
            metrics.recordExtraction(result.status().wireName(), result.processingTime());
            return result;
        } finally {
            MDC.remove(MDC_EXTRACTION_ID);
        }
    }

    private ExtractionResult run(
            String extractionId,
            String transcript,
            PreprocessingOptions preprocessingOptions,
            ExtractionOptions options,
            long start
    ) {
        PreprocessedText preprocessed;
        Map<ExtractionField, Future<Object>> futures = new EnumMap<>(ExtractionField.class);
        try {
            preprocessed = preprocessor.preprocess(transcript, preprocessingOptions);

            String poolId = resolvePoolId(options);
            int window = options.textWindow() != null ? options.textWindow() : defaultTextWindow;
            String text = preprocessed.cleanedText();
            for (ExtractionField field : ExtractionField.values()) {
                futures.put(field, executor.submit(() -> extractField(extractionId, field, text, window, poolId, options)));
            }
        } catch (RuntimeException e) {
            futures.values().forEach(f -> f.cancel(true));
            log.error("Extraction failed: extractionId={}, error={}", extractionId, e.toString());
            return ExtractionResult.failed(extractionId, e.getMessage(), elapsedSince(start));
        }

        Map<ExtractionField, Object> values = new EnumMap<>(ExtractionField.class);
        Set<ExtractionField> failed = EnumSet.noneOf(ExtractionField.class);
        Duration runTimeout = options.runTimeout() != null ? options.runTimeout() : defaultRunTimeout;
        long deadline = runTimeout.isZero() ? 0 : start + runTimeout.toNanos();

        try {
            for (Map.Entry<ExtractionField, Future<Object>> entry : futures.entrySet()) {
                ExtractionField field = entry.getKey();
                try {
                    values.put(field, await(entry.getValue(), deadline));
                } catch (ExecutionException | CancellationException e) {
                    Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                    log.warn("Field extraction failed, using default: extractionId={}, field={}, error={}",
                            extractionId, field.wireName(), cause.toString());
                    failed.add(field);
                    values.put(field, field.defaultValue());
                } catch (TimeoutException e) {
                    entry.getValue().cancel(true);
                    log.warn("Field extraction timed out, using default: extractionId={}, field={}, runTimeoutMs={}",
                            extractionId, field.wireName(), runTimeout.toMillis());
                    failed.add(field);
                    values.put(field, field.defaultValue());
                }
            }
        } catch (InterruptedException e) {
            futures.values().forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            log.warn("Extraction cancelled: extractionId={}", extractionId);
            return ExtractionResult.failed(extractionId, "Extraction cancelled", elapsedSince(start));
        }

        MeetingMinutes minutes = assemble(values);
        ValidationReport validation = validator.validate(minutes, failed);
        double confidence = scorer.score(minutes, validation);
        ExtractionStatus status = validation.overall() ? ExtractionStatus.COMPLETED : ExtractionStatus.VALIDATION_FAILED;
        Duration elapsed = elapsedSince(start);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("extraction_timestamp", Instant.now().toString());
        String poolId = resolvePoolId(options);
        if (poolId != null) {
            metadata.put("pool_id", poolId);
        }
        metadata.put("text_segments", preprocessed.segments().size());
        metadata.put("preprocessing_stats", preprocessed.stats());

        log.info("Extraction completed: extractionId={}, status={}, confidence={}, failedFields={}, elapsedMs={}",
                extractionId, status.wireName(), confidence, failed, elapsed.toMillis());
        return new ExtractionResult(extractionId, status, minutes, validation, confidence,
                failed, elapsed, metadata, null);
    }

    private Object extractField(
            String extractionId,
            ExtractionField field,
            String text,
            int window,
            String poolId,
            ExtractionOptions options
    ) throws Exception {
        MDC.put(MDC_EXTRACTION_ID, extractionId);
        MDC.put(MDC_FIELD, field.wireName());
        try {
            GenerationRequest request = GenerationRequest.ofJson(field.prompt(text, window), field.options());
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("operation", "extract_field");
            context.put("extractionId", extractionId);
            context.put("field", field.wireName());
            if (poolId != null) {
                context.put(EndpointProbeRecoveryAction.POOL_ID_KEY, poolId);
            }
            Object value = retryEngine.handleWithRetry(
                    () -> parser.parse(field, poolManager.callWithFailover(request, poolId).content()),
                    context,
                    options.retryOverride()
            );
            metrics.incrementFieldExtraction(field.wireName(), "success");
            log.debug("Field extracted: extractionId={}, field={}", extractionId, field.wireName());
            return value;
        } catch (Exception e) {
            metrics.incrementFieldExtraction(field.wireName(), "failure");
            throw e;
        } finally {
            MDC.remove(MDC_FIELD);
            MDC.remove(MDC_EXTRACTION_ID);
        }
    }

    private static Object await(Future<Object> future, long deadline)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (deadline == 0) {
            return future.get();
        }
        return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    @SuppressWarnings("unchecked")
    static MeetingMinutes assemble(Map<ExtractionField, Object> values) {
        return new MeetingMinutes(
                (MeetingBasicInfo) values.get(ExtractionField.BASIC_INFO),
                (List<Attendee>) values.get(ExtractionField.ATTENDEES),
                (List<DiscussionTopic>) values.get(ExtractionField.AGENDA),
                (List<ActionItem>) values.get(ExtractionField.ACTION_ITEMS),
                (List<Decision>) values.get(ExtractionField.DECISIONS),
                (List<String>) values.get(ExtractionField.KEY_OUTCOMES)
        );
    }

    private String resolvePoolId(ExtractionOptions options) {
        if (options.poolId() != null) {
            return options.poolId();
        }
        return defaultPoolId != null ? defaultPoolId : poolManager.getCurrentPoolId();
    }

    private static Duration elapsedSince(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
