package fr.lapetina.ollama.minutes.extraction;

import fr.lapetina.ollama.minutes.domain.minutes.Attendee;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingBasicInfo;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingMinutes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();
    private final MinutesValidator validator = new MinutesValidator();

    @Test
    @DisplayName("Should score complete minutes at 1.0")
    void shouldScoreCompleteMinutes() {
        MeetingMinutes minutes = MinutesValidatorTest.completeMinutes();

        assertThat(scorer.richness(minutes)).isCloseTo(1.0, within(1e-9));
        assertThat(scorer.score(minutes, validator.validate(minutes, Set.of()))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should score basic info and attendees alone at 0.76")
    void shouldScoreSparseMinutes() {
        MeetingMinutes minutes = new MeetingMinutes(
                new MeetingBasicInfo("Standup", null, null, null, null, null, null),
                List.of(new Attendee("Alice", null, null, null, null)),
                null, null, null, null);
        ValidationReport report = validator.validate(minutes, Set.of());

        assertThat(report.ratio()).isEqualTo(1.0);
        assertThat(scorer.richness(minutes)).isCloseTo(0.40, within(1e-9));
        assertThat(scorer.score(minutes, report)).isEqualTo(0.76);
    }

    @Test
    @DisplayName("Should score empty minutes on validation alone")
    void shouldScoreEmptyMinutes() {
        MeetingMinutes minutes = new MeetingMinutes(null, null, null, null, null, null);

        // 0.6 * 4/7
        assertThat(scorer.score(minutes, validator.validate(minutes, Set.of()))).isEqualTo(0.34);
    }

    @Test
    @DisplayName("Should score zero when nothing passes and nothing was found")
    void shouldScoreZero() {
        Map<ExtractionField, Boolean> flags = new EnumMap<>(ExtractionField.class);
        for (ExtractionField field : ExtractionField.values()) {
            flags.put(field, false);
        }
        MeetingMinutes minutes = new MeetingMinutes(null, null, null, null, null, null);

        assertThat(scorer.score(minutes, new ValidationReport(flags))).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should lower the score when one field fails")
    void shouldLowerScoreOnFailedField() {
        MeetingMinutes complete = MinutesValidatorTest.completeMinutes();
        MeetingMinutes minutes = new MeetingMinutes(complete.basicInfo(), complete.attendees(),
                complete.agenda(), complete.actionItems(), List.of(), complete.keyOutcomes());

        double score = scorer.score(minutes, validator.validate(minutes, Set.of(ExtractionField.DECISIONS)));

        // 0.6 * 5/7 + 0.4 * 0.85
        assertThat(score).isEqualTo(0.77);
    }
}
