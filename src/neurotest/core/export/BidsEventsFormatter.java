package neurotest.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;

/**
 * BIDS-style {@code events.tsv}. Onset and duration are seconds with three
 * decimals; {@code value} is the marker code; a missing stimulus file is
 * written as {@code n/a}.
 */
public class BidsEventsFormatter implements TimelineFormatter {
    static final String[] HEADER = {"onset", "duration", "value", "event_type", "stim_file"};
    static final String NOT_AVAILABLE = "n/a";

    @Override
    public String format(JsonNode timeline) {
        DelimitedText out = new DelimitedText('\t', "\n");
        out.row((Object[]) HEADER);
        for (JsonNode event : ExportRows.sortedEvents(timeline)) {
            String file = ExportRows.stimulusFileName(event);
            out.row(seconds(ExportRows.onsetMs(event)),
                    seconds(ExportRows.durationMs(event)),
                    ExportRows.markerCode(event),
                    ExportRows.eventType(event),
                    file.isEmpty() ? NOT_AVAILABLE : file);
        }
        return out.toString();
    }

    static String seconds(long ms) {
        return String.format(Locale.ROOT, "%.3f", ms / 1000.0);
    }
}
