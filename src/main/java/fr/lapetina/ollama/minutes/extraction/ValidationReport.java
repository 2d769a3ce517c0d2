package fr.lapetina.ollama.minutes.extraction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-field validation flags plus the overall flag (AND of all fields).
 */
public final class ValidationReport {

    public static final String OVERALL = "overall";

    private final Map<ExtractionField, Boolean> fields;
    private final boolean overall;

    public ValidationReport(Map<ExtractionField, Boolean> fields) {
        EnumMap<ExtractionField, Boolean> copy = new EnumMap<>(ExtractionField.class);
        for (ExtractionField field : ExtractionField.values()) {
            copy.put(field, Boolean.TRUE.equals(fields.get(field)));
        }
        this.fields = Collections.unmodifiableMap(copy);
        this.overall = !copy.containsValue(Boolean.FALSE);
    }

    public boolean passed(ExtractionField field) {
        return fields.get(field);
    }

    public boolean overall() {
        return overall;
    }

    public Map<ExtractionField, Boolean> fields() {
        return fields;
    }

    /**
     * Fraction of passing flags, counting the overall flag as one more.
     */
    public double ratio() {
        long passed = fields.values().stream().filter(Boolean::booleanValue).count() + (overall ? 1 : 0);
        return (double) passed / (fields.size() + 1);
    }

    /**
     * Flags keyed by field name, then {@code overall}.
     */
    @JsonValue
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        fields.forEach((field, passed) -> map.put(field.wireName(), passed));
        map.put(OVERALL, overall);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationReport other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
