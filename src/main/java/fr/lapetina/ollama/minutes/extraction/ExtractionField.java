package fr.lapetina.ollama.minutes.extraction;

import com.fasterxml.jackson.annotation.JsonValue;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingBasicInfo;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The independently extracted parts of a meeting's minutes.
 *
 * Each field carries its prompt, the part of the transcript it reads, its sampling
 * options and its weight in the richness score.
 */
public enum ExtractionField {

    BASIC_INFO(TextWindow.HEAD, 0.1, 0.20, """
            You are an expert meeting minutes analyzer. Extract basic meeting information from the following text.
            Return ONLY a JSON object with these exact fields (use null for missing information):
            {
                "title": "meeting title or subject",
                "date": "meeting date in YYYY-MM-DD format",
                "time": "meeting time",
                "duration": "meeting duration",
                "location": "meeting location or platform",
                "meeting_type": "type of meeting",
                "organizer": "meeting organizer name"
            }

            Text to analyze:
            {text}

            JSON Response:"""),

    ATTENDEES(TextWindow.HEAD, 0.1, 0.20, """
            You are an expert meeting minutes analyzer. Extract attendee information from the following text.
            Return ONLY a JSON array of attendee objects with these exact fields:
            [
                {
                    "name": "full name",
                    "role": "job title or role",
                    "organization": "company or department",
                    "email": "email address if mentioned",
                    "present": true
                }
            ]

            Text to analyze:
            {text}

            JSON Response:"""),

    AGENDA(TextWindow.FULL, 0.2, 0.20, """
            You are an expert meeting minutes analyzer. Extract discussion topics and agenda items from the following text.
            Return ONLY a JSON array of topic objects with these exact fields:
            [
                {
                    "title": "topic or agenda item title",
                    "description": "brief description of discussion",
                    "presenter": "who presented or led the discussion",
                    "duration": "time spent on topic if mentioned",
                    "key_points": ["key point 1", "key point 2", "key point 3"]
                }
            ]

            Text to analyze:
            {text}

            JSON Response:"""),

    ACTION_ITEMS(TextWindow.FULL, 0.1, 0.15, """
            You are an expert meeting minutes analyzer. Extract action items and tasks from the following text.
            Return ONLY a JSON array of action item objects with these exact fields:
            [
                {
                    "task": "description of task or action",
                    "assignee": "person responsible for the task",
                    "due_date": "deadline in YYYY-MM-DD format if mentioned",
                    "priority": "high/medium/low priority if mentioned",
                    "status": "current status if mentioned",
                    "notes": "additional notes about the task"
                }
            ]

            Text to analyze:
            {text}

            JSON Response:"""),

    DECISIONS(TextWindow.FULL, 0.1, 0.15, """
            You are an expert meeting minutes analyzer. Extract decisions made during the meeting from the following text.
            Return ONLY a JSON array of decision objects with these exact fields:
            [
                {
                    "decision": "the decision that was made",
                    "rationale": "reasoning behind the decision",
                    "impact": "expected impact or consequences",
                    "responsible_party": "person or team responsible for implementation",
                    "implementation_date": "when decision takes effect in YYYY-MM-DD format"
                }
            ]

            Text to analyze:
            {text}

            JSON Response:"""),

    KEY_OUTCOMES(TextWindow.TAIL, 0.2, 0.10, """
            You are an expert meeting minutes analyzer. Extract key outcomes and summary points from the following text.
            Return ONLY a JSON array of strings representing key outcomes:
            ["outcome 1", "outcome 2", "outcome 3"]

            Text to analyze:
            {text}

            JSON Response:""");

    /**
     * Part of the transcript a field reads.
     */
    public enum TextWindow {
        /** First {@code window} characters */
        HEAD,
        /** Last {@code window} characters */
        TAIL,
        /** Whole text */
        FULL
    }

    private final TextWindow textWindow;
    private final double temperature;
    private final double richnessWeight;
    private final String promptTemplate;

    ExtractionField(TextWindow textWindow, double temperature, double richnessWeight, String promptTemplate) {
        this.textWindow = textWindow;
        this.temperature = temperature;
        this.richnessWeight = richnessWeight;
        this.promptTemplate = promptTemplate;
    }

    /**
     * Builds the prompt for this field over the given text.
     */
    public String prompt(String text, int window) {
        return promptTemplate.replace("{text}", excerpt(text, window));
    }

    String excerpt(String text, int window) {
        if (text.length() <= window) {
            return text;
        }
        return switch (textWindow) {
            case HEAD -> text.substring(0, window);
            case TAIL -> text.substring(text.length() - window);
            case FULL -> text;
        };
    }

    /**
     * Sampling options sent with the request.
     */
    public Map<String, Object> options() {
        if (this == BASIC_INFO) {
            return Map.of("temperature", temperature, "top_p", 0.9);
        }
        return Map.of("temperature", temperature);
    }

    /**
     * Typed empty value used when extraction fails.
     */
    public Object defaultValue() {
        return this == BASIC_INFO ? MeetingBasicInfo.empty() : List.of();
    }

    public TextWindow getTextWindow() {
        return textWindow;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getRichnessWeight() {
        return richnessWeight;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
