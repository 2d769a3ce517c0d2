package fr.lapetina.ollama.minutes.extraction;

import fr.lapetina.ollama.minutes.domain.minutes.ActionItem;
import fr.lapetina.ollama.minutes.domain.minutes.Attendee;
import fr.lapetina.ollama.minutes.domain.minutes.Decision;
import fr.lapetina.ollama.minutes.domain.minutes.DiscussionTopic;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingBasicInfo;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingMinutes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MinutesValidatorTest {

    private final MinutesValidator validator = new MinutesValidator();

    static MeetingMinutes completeMinutes() {
        return new MeetingMinutes(
                new MeetingBasicInfo("Q3 Planning", "2024-03-05", "10:00", "1h", "Room 4", "planning", "Alice"),
                List.of(new Attendee("Alice", "PM", "Product", null, true)),
                List.of(new DiscussionTopic("Budget", "Review spend", "Bob", null, List.of("cut travel"))),
                List.of(new ActionItem("Send report", "Bob", "2024-03-12", "high", null, null)),
                List.of(new Decision("Adopt vendor B", "cheaper", null, "Procurement", null)),
                List.of("Budget approved")
        );
    }

    @Test
    @DisplayName("Should pass complete minutes")
    void shouldPassCompleteMinutes() {
        ValidationReport report = validator.validate(completeMinutes(), Set.of());

        assertThat(report.overall()).isTrue();
        assertThat(report.ratio()).isEqualTo(1.0);
        assertThat(report.asMap()).containsEntry("overall", true).hasSize(7);
    }

    @Test
    @DisplayName("Should pass empty optional sections but not empty required ones")
    void shouldTreatOptionalSectionsAsPassing() {
        ValidationReport report = validator.validate(new MeetingMinutes(null, null, null, null, null, null), Set.of());

        assertThat(report.passed(ExtractionField.BASIC_INFO)).isFalse();
        assertThat(report.passed(ExtractionField.ATTENDEES)).isFalse();
        assertThat(report.passed(ExtractionField.AGENDA)).isTrue();
        assertThat(report.passed(ExtractionField.ACTION_ITEMS)).isTrue();
        assertThat(report.passed(ExtractionField.DECISIONS)).isTrue();
        assertThat(report.passed(ExtractionField.KEY_OUTCOMES)).isTrue();
        assertThat(report.overall()).isFalse();
        assertThat(report.ratio()).isEqualTo(4.0 / 7.0);
    }

    @Test
    @DisplayName("Should accept a meeting type in place of a title")
    void shouldAcceptMeetingType() {
        MeetingMinutes minutes = new MeetingMinutes(
                new MeetingBasicInfo(null, null, null, null, null, "standup", null),
                List.of(new Attendee("Alice", null, null, null, null)),
                null, null, null, null);

        assertThat(validator.validate(minutes, Set.of()).passed(ExtractionField.BASIC_INFO)).isTrue();
    }

    @Test
    @DisplayName("Should fail attendees when nobody is named")
    void shouldFailUnnamedAttendees() {
        MeetingMinutes minutes = new MeetingMinutes(null,
                List.of(new Attendee(" ", "PM", null, null, true)), null, null, null, null);

        assertThat(validator.validate(minutes, Set.of()).passed(ExtractionField.ATTENDEES)).isFalse();
    }

    @Test
    @DisplayName("Should fail a list section with an entry missing its main text")
    void shouldFailIncompleteEntries() {
        MeetingMinutes minutes = new MeetingMinutes(null, null,
                List.of(new DiscussionTopic("Budget", null, null, null, null),
                        new DiscussionTopic(null, "untitled", null, null, null)),
                List.of(new ActionItem("", "Bob", null, null, null, null)),
                List.of(new Decision(null, "no text", null, null, null)),
                null);

        ValidationReport report = validator.validate(minutes, Set.of());

        assertThat(report.passed(ExtractionField.AGENDA)).isFalse();
        assertThat(report.passed(ExtractionField.ACTION_ITEMS)).isFalse();
        assertThat(report.passed(ExtractionField.DECISIONS)).isFalse();
    }

    @Test
    @DisplayName("Should fail a failed field even when its default would pass")
    void shouldFailFailedFields() {
        MeetingMinutes minutes = new MeetingMinutes(
                completeMinutes().basicInfo(), completeMinutes().attendees(),
                completeMinutes().agenda(), completeMinutes().actionItems(),
                List.of(), completeMinutes().keyOutcomes());

        ValidationReport report = validator.validate(minutes, Set.of(ExtractionField.DECISIONS));

        assertThat(report.passed(ExtractionField.DECISIONS)).isFalse();
        assertThat(report.passed(ExtractionField.AGENDA)).isTrue();
        assertThat(report.overall()).isFalse();
        assertThat(report.ratio()).isEqualTo(5.0 / 7.0);
    }
}
