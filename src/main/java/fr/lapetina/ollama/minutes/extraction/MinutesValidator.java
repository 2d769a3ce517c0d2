package fr.lapetina.ollama.minutes.extraction;

import fr.lapetina.ollama.minutes.domain.minutes.ActionItem;
import fr.lapetina.ollama.minutes.domain.minutes.Attendee;
import fr.lapetina.ollama.minutes.domain.minutes.Decision;
import fr.lapetina.ollama.minutes.domain.minutes.DiscussionTopic;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingMinutes;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation of extracted minutes.
 *
 * Basic info needs a title or a meeting type; attendees need at least one named entry.
 * Agenda, action items and decisions are optional: empty passes, otherwise every entry
 * needs its title, task or decision text. Key outcomes always pass.
 * A field whose extraction failed never passes, whatever its default value.
 */
public final class MinutesValidator {

    public ValidationReport validate(MeetingMinutes minutes, Set<ExtractionField> failedFields) {
        Map<ExtractionField, Boolean> flags = new EnumMap<>(ExtractionField.class);
        for (ExtractionField field : ExtractionField.values()) {
            flags.put(field, !failedFields.contains(field) && check(field, minutes));
        }
        return new ValidationReport(flags);
    }

    static boolean check(ExtractionField field, MeetingMinutes minutes) {
        return switch (field) {
            case BASIC_INFO -> minutes.basicInfo().isIdentified();
            case ATTENDEES -> minutes.attendees().stream().anyMatch(Attendee::isNamed);
            case AGENDA -> minutes.agenda().stream().allMatch(DiscussionTopic::hasTitle);
            case ACTION_ITEMS -> minutes.actionItems().stream().allMatch(ActionItem::hasTask);
            case DECISIONS -> minutes.decisions().stream().allMatch(Decision::hasDecision);
            case KEY_OUTCOMES -> true;
        };
    }
}
