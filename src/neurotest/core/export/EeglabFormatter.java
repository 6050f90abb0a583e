package neurotest.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Tab-delimited event list for EEGLAB's event import: a header, a comment
 * block naming the test, the header again, then one row per event.
 */
public class EeglabFormatter implements TimelineFormatter {
    static final String[] HEADER = {"Latency(ms)", "Type", "Duration(ms)", "EventID", "StimulusFile"};

    @Override
    public String format(JsonNode timeline) {
        DelimitedText out = new DelimitedText('\t', "\r\n");
        out.row((Object[]) HEADER);
        out.row("# Exported from Neuroscience Test Maker");
        out.row("# Test: " + ExportRows.testName(timeline));
        out.row("# Description: " + ExportRows.testDescription(timeline));
        out.blank();
        out.row((Object[]) HEADER);

        List<JsonNode> events = ExportRows.sortedEvents(timeline);
        int index = 1;
        for (JsonNode event : events) {
            out.row(ExportRows.onsetMs(event),
                    ExportRows.eventType(event),
                    ExportRows.durationMs(event),
                    index++,
                    ExportRows.stimulusFileName(event));
        }
        return out.toString();
    }
}
