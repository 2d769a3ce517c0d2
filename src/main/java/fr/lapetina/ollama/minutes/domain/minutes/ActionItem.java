package fr.lapetina.ollama.minutes.domain.minutes;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Task assigned during the meeting.
 */
public record ActionItem(
        String task,
        String assignee,
        @JsonProperty("due_date") String dueDate,
        String priority,
        String status,
        String notes
) {
    public boolean hasTask() {
        return task != null && !task.isBlank();
    }
}
