package neurotest.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.io.Files;
import java.util.Locale;

/**
 * Procedure/trial table in the tab-delimited layout E-Prime reads, bracketed
 * by header and footer marker lines. Starts with a UTF-8 byte-order mark so
 * spreadsheet tools pick the right encoding.
 */
public class EprimeFormatter implements TimelineFormatter {
    static final String BOM = "\uFEFF";
    static final String PROCEDURE = "TrialProc";
    static final String[] HEADER = {"Procedure", "Trial", "Stimulus", "StimulusFile", "OnsetTime", "Duration", "Type", "Modality"};

    @Override
    public String format(JsonNode timeline) {
        DelimitedText out = new DelimitedText('\t', "\r\n");
        out.row("*** Header Start ***");
        out.row("VersionNumber:", "1.0");
        out.row("LevelName:", "Session");
        out.row("Title:", ExportRows.testName(timeline));
        out.row("Description:", ExportRows.testDescription(timeline));
        out.row("Exported:", "Neuroscience Test Maker");
        out.row("*** Header End ***");
        out.blank();
        out.row((Object[]) HEADER);

        int trial = 1;
        for (JsonNode event : ExportRows.sortedEvents(timeline)) {
            String type = ExportRows.eventType(event);
            String file = ExportRows.stimulusFileName(event);
            String stimulus = file.isEmpty() ? type + "_" + trial : Files.getNameWithoutExtension(file);
            out.row(PROCEDURE,
                    trial,
                    stimulus,
                    file,
                    ExportRows.onsetMs(event),
                    ExportRows.durationMs(event),
                    type,
                    type.toUpperCase(Locale.ROOT));
            trial++;
        }

        out.blank();
        out.row("*** End of data ***");
        return BOM + out;
    }
}
