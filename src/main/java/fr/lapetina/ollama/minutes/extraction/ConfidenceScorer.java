package fr.lapetina.ollama.minutes.extraction;

import fr.lapetina.ollama.minutes.domain.minutes.MeetingMinutes;

/**
 * Confidence = VALIDATION_WEIGHT × validation ratio + RICHNESS_WEIGHT × richness,
 * clamped to [0, 1] and rounded to two decimals.
 *
 * Richness adds each field's {@link ExtractionField#getRichnessWeight() weight} when the
 * field has content.
 */
public final class ConfidenceScorer {

    public static final double VALIDATION_WEIGHT = 0.6;
    public static final double RICHNESS_WEIGHT = 0.4;

    public double score(MeetingMinutes minutes, ValidationReport report) {
        double raw = VALIDATION_WEIGHT * report.ratio() + RICHNESS_WEIGHT * richness(minutes);
        double clamped = Math.min(1.0, Math.max(0.0, raw));
        return Math.round(clamped * 100.0) / 100.0;
    }

    public double richness(MeetingMinutes minutes) {
        double richness = 0.0;
        for (ExtractionField field : ExtractionField.values()) {
            if (hasContent(field, minutes)) {
                richness += field.getRichnessWeight();
            }
        }
        return richness;
    }

    static boolean hasContent(ExtractionField field, MeetingMinutes minutes) {
        return switch (field) {
            case BASIC_INFO -> minutes.basicInfo().isIdentified();
            case ATTENDEES -> !minutes.attendees().isEmpty();
            case AGENDA -> !minutes.agenda().isEmpty();
            case ACTION_ITEMS -> !minutes.actionItems().isEmpty();
            case DECISIONS -> !minutes.decisions().isEmpty();
            case KEY_OUTCOMES -> !minutes.keyOutcomes().isEmpty();
        };
    }
}
