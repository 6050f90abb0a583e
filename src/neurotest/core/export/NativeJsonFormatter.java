package neurotest.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import neurotest.core.persistence.TimelineCodec;

/**
 * The canonical structured form itself, pretty-printed. Reloadable by the editor.
 */
public class NativeJsonFormatter implements TimelineFormatter {

    @Override
    public String format(JsonNode timeline) {
        try {
            return TimelineCodec.mapper().writeValueAsString(timeline);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize timeline", e);
        }
    }
}
