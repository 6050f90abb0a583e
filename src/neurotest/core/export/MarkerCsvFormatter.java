package neurotest.core.export;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Comma-separated trigger list: one row per event with its marker code
 * (1 when the event has none).
 */
public class MarkerCsvFormatter implements TimelineFormatter {
    static final String[] HEADER = {"onset_ms", "duration_ms", "marker_code", "event_type", "stimulus_file"};

    @Override
    public String format(JsonNode timeline) {
        DelimitedText out = new DelimitedText(',', "\n");
        out.row((Object[]) HEADER);
        for (JsonNode event : ExportRows.sortedEvents(timeline)) {
            out.row(ExportRows.onsetMs(event),
                    ExportRows.durationMs(event),
                    ExportRows.markerCode(event),
                    ExportRows.eventType(event),
                    ExportRows.stimulusFileName(event));
        }
        return out.toString();
    }
}
