package fr.lapetina.ollama.minutes.infrastructure.recovery;

import fr.lapetina.ollama.minutes.domain.recovery.ErrorInfo;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import fr.lapetina.ollama.minutes.domain.recovery.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bounded record of terminal failures, bucketed per error type per UTC day.
 *
 * Each bucket keeps its newest {@code capacity} entries. Buckets of days older than
 * {@code retentionDays} before the newest recorded day are dropped. Reads return copies.
 */
public final class ErrorHistory {

    private static final Logger log = LoggerFactory.getLogger(ErrorHistory.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final int capacity;
    private final int retentionDays;
    private final Map<String, Deque<ErrorInfo>> buckets = new TreeMap<>();
    private Instant newest;

    public ErrorHistory(int capacity, int retentionDays) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be positive: " + retentionDays);
        }
        this.capacity = capacity;
        this.retentionDays = retentionDays;
    }

    public ErrorHistory(int capacity) {
        this(capacity, 7);
    }

    public ErrorHistory() {
        this(100);
    }

    /**
     * Records an error. Never throws.
     */
    public void record(ErrorInfo errorInfo) {
        try {
            String key = bucketKey(errorInfo);
            synchronized (buckets) {
                Deque<ErrorInfo> bucket = buckets.computeIfAbsent(key, k -> new ArrayDeque<>());
                bucket.addLast(errorInfo);
                while (bucket.size() > capacity) {
                    bucket.removeFirst();
                }
                if (newest == null || errorInfo.timestamp().isAfter(newest)) {
                    newest = errorInfo.timestamp();
                }
                dropExpiredBuckets();
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record error in history: errorId={}, error={}", errorInfo.errorId(), e.toString());
        }
    }

    // Caller holds the buckets lock
    private void dropExpiredBuckets() {
        String oldestKept = DAY.format(newest.minus(Duration.ofDays(retentionDays - 1L)));
        Iterator<Map.Entry<String, Deque<ErrorInfo>>> it = buckets.entrySet().iterator();
        while (it.hasNext()) {
            String key = it.next().getKey();
            String day = key.substring(key.lastIndexOf('_') + 1);
            if (day.compareTo(oldestKept) < 0) {
                it.remove();
                log.debug("Error history bucket expired: bucketKey={}", key);
            }
        }
    }

    static String bucketKey(ErrorInfo errorInfo) {
        return errorInfo.errorType().wireName() + "_" + DAY.format(errorInfo.timestamp());
    }

    public List<ErrorInfo> entries(String bucketKey) {
        synchronized (buckets) {
            Deque<ErrorInfo> bucket = buckets.get(bucketKey);
            return bucket == null ? List.of() : List.copyOf(bucket);
        }
    }

    public ErrorStatistics statistics() {
        return statisticsOf(allEntries(), bucketKeys());
    }

    /**
     * Entries with {@code from <= timestamp < to}, oldest first, with their statistics.
     */
    public ErrorReport report(Instant from, Instant to) {
        List<ErrorInfo> window = allEntries().stream()
                .filter(e -> !e.timestamp().isBefore(from) && e.timestamp().isBefore(to))
                .sorted(Comparator.comparing(ErrorInfo::timestamp))
                .toList();
        List<String> keys = window.stream().map(ErrorHistory::bucketKey).distinct().sorted().toList();
        return new ErrorReport(from, to, window, statisticsOf(window, keys));
    }

    private List<ErrorInfo> allEntries() {
        synchronized (buckets) {
            List<ErrorInfo> all = new ArrayList<>();
            buckets.values().forEach(all::addAll);
            return all;
        }
    }

    private List<String> bucketKeys() {
        synchronized (buckets) {
            return List.copyOf(buckets.keySet());
        }
    }

    private static ErrorStatistics statisticsOf(List<ErrorInfo> entries, List<String> keys) {
        Map<ErrorType, Long> byType = new EnumMap<>(ErrorType.class);
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (ErrorInfo e : entries) {
            byType.merge(e.errorType(), 1L, Long::sum);
            bySeverity.merge(e.severity(), 1L, Long::sum);
        }
        return new ErrorStatistics(entries.size(), byType, bySeverity, keys);
    }

    public int getCapacity() {
        return capacity;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public record ErrorStatistics(
            long totalErrors,
            Map<ErrorType, Long> errorsByType,
            Map<Severity, Long> errorsBySeverity,
            List<String> bucketKeys
    ) {
        public ErrorStatistics {
            errorsByType = Map.copyOf(errorsByType);
            errorsBySeverity = Map.copyOf(errorsBySeverity);
            bucketKeys = List.copyOf(bucketKeys);
        }
    }

    public record ErrorReport(Instant from, Instant to, List<ErrorInfo> entries, ErrorStatistics statistics) {
        public ErrorReport {
            entries = List.copyOf(entries);
        }
    }
}
