package fr.lapetina.ollama.minutes.infrastructure.recovery;

import fr.lapetina.ollama.minutes.domain.recovery.ClassifiedFailure;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorInfo;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import fr.lapetina.ollama.minutes.domain.recovery.Severity;

import javax.net.ssl.SSLException;
import java.io.FileNotFoundException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.file.FileSystemException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maps exceptions onto the {@link ErrorType} taxonomy.
 *
 * Order: self-classified exceptions, then exception types, then message keywords.
 * Wrappers from futures are unwrapped first.
 */
public final class ErrorClassifier {

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;
    private final AtomicInteger sequence = new AtomicInteger();

    public ErrorClassifier(Clock clock) {
        this.clock = clock;
    }

    public ErrorClassifier() {
        this(Clock.systemUTC());
    }

    public ErrorInfo classify(Throwable error, Map<String, Object> context) {
        Throwable cause = unwrap(error);
        ErrorType type = determineType(cause);
        return new ErrorInfo(
                nextErrorId(),
                type,
                String.valueOf(cause.getMessage()),
                cause.getClass(),
                severity(type, cause),
                type.isRecoverable(),
                suggestedAction(type),
                context,
                clock.instant()
        );
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    ErrorType determineType(Throwable error) {
        if (error instanceof ClassifiedFailure classified) {
            return classified.errorType();
        }
        // Connect timeouts are timeouts by type but connection failures by nature
        if (error instanceof HttpConnectTimeoutException) {
            return ErrorType.NETWORK;
        }
        if (error instanceof HttpTimeoutException
                || error instanceof SocketTimeoutException
                || error instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (error instanceof ConnectException
                || error instanceof UnknownHostException
                || error instanceof NoRouteToHostException
                || error instanceof SSLException
                || error instanceof SocketException) {
            return ErrorType.NETWORK;
        }
        if (error instanceof FileSystemException || error instanceof FileNotFoundException) {
            return ErrorType.FILESYSTEM;
        }
        if (error instanceof UncheckedIOException && error.getCause() != null) {
            return determineType(error.getCause());
        }
        if (error instanceof OutOfMemoryError
                || error instanceof StackOverflowError
                || error instanceof RejectedExecutionException) {
            return ErrorType.RESOURCE;
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorType.VALIDATION;
        }
        return fromMessage(error.getMessage());
    }

    private static ErrorType fromMessage(String message) {
        if (message == null) {
            return ErrorType.UNKNOWN;
        }
        String text = message.toLowerCase(Locale.ROOT);
        if (text.contains("ollama") || text.contains("llm")) {
            return ErrorType.AI_SERVICE;
        }
        if (text.contains("connection") || text.contains("network")
                || text.contains("dns") || text.contains("ssl")) {
            return ErrorType.NETWORK;
        }
        return ErrorType.UNKNOWN;
    }

    static Severity severity(ErrorType type, Throwable error) {
        return switch (type) {
            case RESOURCE -> error instanceof OutOfMemoryError ? Severity.CRITICAL : Severity.MEDIUM;
            case AI_SERVICE, FILESYSTEM -> Severity.HIGH;
            case VALIDATION, USER -> Severity.LOW;
            case NETWORK, TIMEOUT, PROCESSING, UNKNOWN -> Severity.MEDIUM;
        };
    }

    static String suggestedAction(ErrorType type) {
        return switch (type) {
            case NETWORK -> "Check network connectivity and retry";
            case TIMEOUT -> "Increase timeout settings or reduce payload size";
            case VALIDATION -> "Verify input data format and requirements";
            case AI_SERVICE -> "Check AI service status or use alternative model";
            case FILESYSTEM -> "Check file permissions and available disk space";
            case PROCESSING -> "Review processing parameters and input data";
            case RESOURCE -> "Free up system resources or reduce concurrent operations";
            case USER -> "Review user input and correct invalid data";
            case UNKNOWN -> "Review error details and try again";
        };
    }

    private String nextErrorId() {
        int n = Math.floorMod(sequence.getAndIncrement(), 10_000);
        return "err_" + LocalDateTime.now(clock).format(ID_FORMAT) + "_" + String.format(Locale.ROOT, "%04d", n);
    }
}
