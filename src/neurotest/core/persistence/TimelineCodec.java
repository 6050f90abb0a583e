package neurotest.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import neurotest.core.error.FormatException;
import neurotest.core.model.AudioPayload;
import neurotest.core.model.ImagePayload;
import neurotest.core.model.ImagePosition;
import neurotest.core.model.StimulusEvent;
import neurotest.core.model.StimulusKind;
import neurotest.core.model.StimulusPayload;
import neurotest.core.model.Timeline;
import neurotest.core.model.TimelineMetadata;

/**
 * Converts between a {@link Timeline} and its canonical structured form:
 * <pre>
 * { "metadata": { "name", "description", "duration_ms" },
 *   "events": [ { "event_type", "timestamp_ms", "data": { ... } } ] }
 * </pre>
 */
public final class TimelineCodec {

    public static final String METADATA = "metadata";
    public static final String EVENTS = "events";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String DURATION_MS = "duration_ms";
    public static final String EVENT_TYPE = "event_type";
    public static final String TIMESTAMP_MS = "timestamp_ms";
    public static final String DATA = "data";
    public static final String FILE_PATH = "file_path";
    /** Written by early versions of the editor; read as {@link #FILE_PATH}. */
    public static final String LEGACY_FILE_PATH = "filepath";
    public static final String POSITION = "position";
    public static final String VOLUME = "volume";
    public static final String MARKER_CODE = "marker_code";

    private static final Set<String> IMAGE_DATA_KEYS = Set.of(FILE_PATH, DURATION_MS, POSITION, MARKER_CODE);
    private static final Set<String> AUDIO_DATA_KEYS = Set.of(FILE_PATH, DURATION_MS, VOLUME, MARKER_CODE);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private TimelineCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // --- Encoding ---

    public static ObjectNode encode(Timeline timeline) {
        ObjectNode root = MAPPER.createObjectNode();
        TimelineMetadata meta = timeline.getMetadata();
        ObjectNode metaNode = root.putObject(METADATA);
        metaNode.put(NAME, meta.getName());
        metaNode.put(DESCRIPTION, meta.getDescription());
        metaNode.put(DURATION_MS, meta.getDurationMs());

        ArrayNode eventsNode = root.putArray(EVENTS);
        for (StimulusEvent event : timeline.getEvents()) {
            eventsNode.add(encodeEvent(event));
        }
        return root;
    }

    public static ObjectNode encodeEvent(StimulusEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(EVENT_TYPE, event.getKind().getWireName());
        node.put(TIMESTAMP_MS, event.getOnsetMs());

        StimulusPayload payload = event.getPayload();
        ObjectNode data = node.putObject(DATA);
        data.put(FILE_PATH, payload.getFilePath());
        data.put(DURATION_MS, event.getDurationMs());
        if (payload instanceof ImagePayload) {
            data.put(POSITION, ((ImagePayload) payload).getPosition().getWireName());
        } else if (payload instanceof AudioPayload) {
            data.put(VOLUME, ((AudioPayload) payload).getVolume());
        }
        if (payload.getMarkerCode() != null) {
            data.put(MARKER_CODE, payload.getMarkerCode());
        }
        for (Map.Entry<String, JsonNode> extra : payload.getExtras().entrySet()) {
            // typed fields own their keys, even when left unset
            if (!knownDataKeys(event.getKind()).contains(extra.getKey())) {
                data.set(extra.getKey(), extra.getValue().deepCopy());
            }
        }
        return node;
    }

    // --- Decoding ---

    /**
     * All-or-nothing: every event is parsed before the timeline is built.
     *
     * @throws FormatException describing the first problem found
     */
    public static Timeline decode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new FormatException("Timeline data must be a JSON object");
        }

        String name = TimelineMetadata.DEFAULT_NAME;
        String description = "";
        JsonNode metaNode = root.get(METADATA);
        if (metaNode != null && !metaNode.isNull()) {
            if (!metaNode.isObject()) {
                throw new FormatException("'" + METADATA + "' must be an object");
            }
            name = optionalText(metaNode, NAME, name, METADATA);
            description = optionalText(metaNode, DESCRIPTION, description, METADATA);
        }

        List<StimulusEvent> parsed = new ArrayList<>();
        JsonNode eventsNode = root.get(EVENTS);
        if (eventsNode != null && !eventsNode.isNull()) {
            if (!eventsNode.isArray()) {
                throw new FormatException("'" + EVENTS + "' must be an array");
            }
            int index = 0;
            for (JsonNode eventNode : eventsNode) {
                parsed.add(decodeEvent(eventNode, index++));
            }
        }

        Timeline timeline = new Timeline();
        timeline.getMetadata().setName(name);
        timeline.getMetadata().setDescription(description);
        timeline.addEvents(parsed);
        return timeline;
    }

    static StimulusEvent decodeEvent(JsonNode node, int index) {
        String where = "events[" + index + "]";
        if (!node.isObject()) {
            throw new FormatException(where + " must be an object");
        }
        String type = requiredText(node, EVENT_TYPE, where);
        StimulusKind kind = StimulusKind.fromWireName(type);
        if (kind == null) {
            throw new FormatException(where + " has unknown " + EVENT_TYPE + " '" + type + "'");
        }
        long onset = requiredLong(node, TIMESTAMP_MS, where);

        JsonNode data = node.get(DATA);
        if (data == null || !data.isObject()) {
            throw new FormatException(where + " is missing the '" + DATA + "' object");
        }
        String dataWhere = where + "." + DATA;
        String filePath;
        String filePathKey;
        if (data.has(FILE_PATH)) {
            filePathKey = FILE_PATH;
            filePath = requiredText(data, FILE_PATH, dataWhere);
        } else if (data.has(LEGACY_FILE_PATH)) {
            filePathKey = LEGACY_FILE_PATH;
            filePath = requiredText(data, LEGACY_FILE_PATH, dataWhere);
        } else {
            throw new FormatException(dataWhere + " is missing '" + FILE_PATH + "'");
        }
        long duration = requiredLong(data, DURATION_MS, dataWhere);

        StimulusPayload payload;
        if (kind == StimulusKind.IMAGE) {
            ImagePosition position = ImagePosition.CENTER;
            if (data.hasNonNull(POSITION)) {
                String raw = requiredText(data, POSITION, dataWhere);
                position = ImagePosition.fromWireName(raw);
                if (position == null) {
                    throw new FormatException(dataWhere + " has unknown " + POSITION + " '" + raw + "'");
                }
            }
            payload = new ImagePayload(filePath, position);
        } else {
            double volume = AudioPayload.DEFAULT_VOLUME;
            if (data.hasNonNull(VOLUME)) {
                JsonNode v = data.get(VOLUME);
                if (!v.isNumber()) {
                    throw new FormatException(dataWhere + "." + VOLUME + " must be a number");
                }
                volume = v.doubleValue();
            }
            payload = new AudioPayload(filePath, volume);
        }

        if (data.hasNonNull(MARKER_CODE)) {
            JsonNode code = data.get(MARKER_CODE);
            if (!code.isIntegralNumber() || !code.canConvertToInt()) {
                throw new FormatException(dataWhere + "." + MARKER_CODE + " must be an integer");
            }
            payload.setMarkerCode(code.intValue());
        }

        Set<String> known = knownDataKeys(kind);
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            // an unused filepath alias is kept like any other unknown key
            if (!known.contains(key) && !key.equals(filePathKey)) {
                payload.getExtras().put(field.getKey(), field.getValue().deepCopy());
            }
        }
        return new StimulusEvent(onset, duration, payload);
    }

    private static Set<String> knownDataKeys(StimulusKind kind) {
        return kind == StimulusKind.IMAGE ? IMAGE_DATA_KEYS : AUDIO_DATA_KEYS;
    }

    private static String requiredText(JsonNode node, String key, String where) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            throw new FormatException(where + " is missing '" + key + "'");
        }
        if (!value.isTextual()) {
            throw new FormatException(where + "." + key + " must be a string");
        }
        return value.textValue();
    }

    private static long requiredLong(JsonNode node, String key, String where) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            throw new FormatException(where + " is missing '" + key + "'");
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new FormatException(where + "." + key + " must be an integer");
        }
        return value.longValue();
    }

    private static String optionalText(JsonNode node, String key, String fallback, String where) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) return fallback;
        if (!value.isTextual()) {
            throw new FormatException(where + "." + key + " must be a string");
        }
        return value.textValue();
    }
}
