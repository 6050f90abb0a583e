package neurotest.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import neurotest.core.model.StimulusPayload;
import neurotest.core.persistence.TimelineCodec;

/**
 * Lenient readers over a timeline's structured form, shared by the formatters.
 * Missing values fall back to neutral defaults instead of failing.
 */
final class ExportRows {
    static final String UNKNOWN_TYPE = "unknown";
    static final String UNTITLED = "Untitled";

    private ExportRows() {
    }

    /**
     * Events ascending by {@code timestamp_ms}; equal timestamps keep input order.
     */
    static List<JsonNode> sortedEvents(JsonNode timeline) {
        List<JsonNode> events = new ArrayList<>();
        for (JsonNode e : timeline.path(TimelineCodec.EVENTS)) {
            events.add(e);
        }
        events.sort(Comparator.comparingLong(ExportRows::onsetMs));
        return events;
    }

    static String testName(JsonNode timeline) {
        return timeline.path(TimelineCodec.METADATA).path(TimelineCodec.NAME).asText(UNTITLED);
    }

    static String testDescription(JsonNode timeline) {
        return timeline.path(TimelineCodec.METADATA).path(TimelineCodec.DESCRIPTION).asText("");
    }

    static String eventType(JsonNode event) {
        return event.path(TimelineCodec.EVENT_TYPE).asText(UNKNOWN_TYPE);
    }

    static long onsetMs(JsonNode event) {
        return event.path(TimelineCodec.TIMESTAMP_MS).asLong(0);
    }

    static long durationMs(JsonNode event) {
        return event.path(TimelineCodec.DATA).path(TimelineCodec.DURATION_MS).asLong(0);
    }

    static int markerCode(JsonNode event) {
        return event.path(TimelineCodec.DATA).path(TimelineCodec.MARKER_CODE).asInt(StimulusPayload.DEFAULT_MARKER_CODE);
    }

    /**
     * File name of the stimulus without its directories, empty if none.
     */
    static String stimulusFileName(JsonNode event) {
        JsonNode data = event.path(TimelineCodec.DATA);
        String path = data.path(TimelineCodec.FILE_PATH).asText("");
        if (path.isEmpty()) {
            path = data.path(TimelineCodec.LEGACY_FILE_PATH).asText("");
        }
        return StimulusPayload.fileNameOf(path);
    }
}
