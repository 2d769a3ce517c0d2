package fr.lapetina.ollama.minutes.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import fr.lapetina.ollama.minutes.domain.minutes.ActionItem;
import fr.lapetina.ollama.minutes.domain.minutes.Attendee;
import fr.lapetina.ollama.minutes.domain.minutes.Decision;
import fr.lapetina.ollama.minutes.domain.minutes.DiscussionTopic;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingBasicInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a model answer into the typed value of an {@link ExtractionField}.
 *
 * Models do not always follow the requested shape, so the parser accepts:
 * - an object wrapping the expected array (e.g. {@code {"attendees": [...]}})
 * - a single object where an array of objects is expected
 * - an array where the basic info object is expected (first element is used)
 * Array entries of the wrong kind and entries that do not map are dropped.
 */
public final class FieldParser {

    private static final Logger log = LoggerFactory.getLogger(FieldParser.class);

    private final ObjectMapper objectMapper;

    public FieldParser() {
        this.objectMapper = JsonMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .build();
    }

    /**
     * @return {@link MeetingBasicInfo} for basic info, a list of the field's item type otherwise
     * @throws MalformedExtractionException if the content is not JSON of a usable shape
     */
    public Object parse(ExtractionField field, String content) {
        JsonNode root = readTree(field, content);
        return switch (field) {
            case BASIC_INFO -> parseBasicInfo(root);
            case ATTENDEES -> parseObjects(field, root, Attendee.class);
            case AGENDA -> parseObjects(field, root, DiscussionTopic.class);
            case ACTION_ITEMS -> parseObjects(field, root, ActionItem.class);
            case DECISIONS -> parseObjects(field, root, Decision.class);
            case KEY_OUTCOMES -> parseOutcomes(root);
        };
    }

    private JsonNode readTree(ExtractionField field, String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedExtractionException(field, "Empty response for field " + field.wireName());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content.strip());
        } catch (JsonProcessingException e) {
            throw new MalformedExtractionException(field,
                    "Invalid JSON for field " + field.wireName() + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isContainerNode()) {
            throw new MalformedExtractionException(field,
                    "Expected a JSON object or array for field " + field.wireName());
        }
        return root;
    }

    private MeetingBasicInfo parseBasicInfo(JsonNode root) {
        JsonNode node = root;
        if (root.isArray()) {
            node = root.size() > 0 && root.get(0).isObject() ? root.get(0) : null;
        }
        if (node == null) {
            throw new MalformedExtractionException(ExtractionField.BASIC_INFO,
                    "Expected a JSON object for field basic_info");
        }
        try {
            return objectMapper.treeToValue(node, MeetingBasicInfo.class);
        } catch (JsonProcessingException e) {
            throw new MalformedExtractionException(ExtractionField.BASIC_INFO,
                    "Unreadable basic_info: " + e.getOriginalMessage(), e);
        }
    }

    private <T> List<T> parseObjects(ExtractionField field, JsonNode root, Class<T> type) {
        JsonNode array = unwrapArray(field, root);
        if (array == null) {
            array = objectMapper.createArrayNode().add(root);
        }
        List<T> items = new ArrayList<>();
        for (JsonNode element : array) {
            if (!element.isObject()) {
                continue;
            }
            try {
                items.add(objectMapper.treeToValue(element, type));
            } catch (JsonProcessingException e) {
                log.warn("Dropping unreadable entry: field={}, error={}", field.wireName(), e.getOriginalMessage());
            }
        }
        return items;
    }

    private List<String> parseOutcomes(JsonNode root) {
        JsonNode array = unwrapArray(ExtractionField.KEY_OUTCOMES, root);
        List<String> outcomes = new ArrayList<>();
        if (array == null) {
            return outcomes;
        }
        for (JsonNode element : array) {
            if (element.isValueNode() && !element.isNull()) {
                String text = element.asText().strip();
                if (!text.isEmpty()) {
                    outcomes.add(text);
                }
            }
        }
        return outcomes;
    }

    /**
     * The array itself, the array under the field's own key, or the first array-valued
     * property of a wrapping object. Null if the root is an object without one.
     */
    private static JsonNode unwrapArray(ExtractionField field, JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        JsonNode own = root.get(field.wireName());
        if (own != null && own.isArray()) {
            return own;
        }
        Iterator<Map.Entry<String, JsonNode>> properties = root.fields();
        while (properties.hasNext()) {
            JsonNode value = properties.next().getValue();
            if (value.isArray()) {
                return value;
            }
        }
        return null;
    }
}
