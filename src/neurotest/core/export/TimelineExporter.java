package neurotest.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import neurotest.core.model.Timeline;
import neurotest.core.persistence.TimelineStorage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes a timeline to disk in one of the {@link ExportFormat}s.
 * One-shot: failures propagate to the caller and nothing is retried.
 */
public class TimelineExporter {
    private static final Logger logger = LogManager.getLogger(TimelineExporter.class);

    private final TimelineStorage storage;

    public TimelineExporter(TimelineStorage storage) {
        this.storage = storage;
    }

    public void export(Timeline timeline, Path target, ExportFormat format) throws IOException {
        export(timeline.toSerializable(), target, format);
    }

    /**
     * @throws IOException if the target directory is missing or the file cannot be written
     */
    public void export(JsonNode timeline, Path target, ExportFormat format) throws IOException {
        String content = format.formatter().format(timeline);
        storage.write(target, content);
        logger.info("Exported {} as {} to {}", ExportRows.testName(timeline), format.getDisplayName(), target);
    }

    /**
     * @throws neurotest.core.error.UnsupportedFormatException for an unknown selector
     */
    public void export(JsonNode timeline, Path target, String formatId) throws IOException {
        export(timeline, target, ExportFormat.fromId(formatId));
    }

    /**
     * Picks the format from the target's name, see {@link #detectFormat}.
     */
    public ExportFormat export(JsonNode timeline, Path target) throws IOException {
        ExportFormat format = detectFormat(target);
        export(timeline, target, format);
        return format;
    }

    /**
     * {@code .json} is native; {@code .txt} is an EEGLAB list unless the file
     * name mentions eprime or e-prime (a mention of eeg, eeglab included, wins);
     * {@code .csv} and {@code .tsv} are the marker and BIDS tables. Anything
     * else falls back to native JSON.
     */
    public static ExportFormat detectFormat(Path target) {
        Path namePath = target.getFileName();
        String fileName = namePath == null ? "" : namePath.toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        String ext = dot > 0 ? fileName.substring(dot) : "";
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;

        switch (ext) {
            case ".json":
                return ExportFormat.JSON;
            case ".txt":
                if (stem.contains("eeg")) return ExportFormat.EEGLAB;
                if (stem.contains("eprime") || stem.contains("e-prime")) return ExportFormat.EPRIME;
                return ExportFormat.EEGLAB;
            case ".csv":
                return ExportFormat.MARKER_CSV;
            case ".tsv":
                return ExportFormat.BIDS_TSV;
            default:
                return ExportFormat.JSON;
        }
    }

    /**
     * Filters for a save dialog: all supported first, one per format, all files last.
     */
    public static List<FileFilter> fileFilters() {
        List<FileFilter> filters = new ArrayList<>();
        StringBuilder all = new StringBuilder();
        for (ExportFormat f : ExportFormat.values()) {
            String pattern = f.getFilterPattern();
            if (all.indexOf(pattern) < 0) {
                if (all.length() > 0) all.append(' ');
                all.append(pattern);
            }
        }
        filters.add(new FileFilter("All supported formats", all.toString()));
        for (ExportFormat f : ExportFormat.values()) {
            filters.add(new FileFilter(f.getFilterLabel(), f.getFilterPattern()));
        }
        filters.add(new FileFilter("All files", "*.*"));
        return Collections.unmodifiableList(filters);
    }

    public static class FileFilter {
        private final String description;
        private final String pattern;

        public FileFilter(String description, String pattern) {
            this.description = description;
            this.pattern = pattern;
        }

        public String getDescription() { return description; }
        public String getPattern() { return pattern; }

        @Override
        public String toString() {
            return description + " (" + pattern + ")";
        }
    }
}
