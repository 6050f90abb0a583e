package neurotest.core.export;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Renders a timeline's structured form as the text of one export file.
 * Implementations never modify their input and must cope with data they did
 * not produce: unsorted events and missing optional fields.
 */
public interface TimelineFormatter {

    String format(JsonNode timeline);
}
