package neurotest.core.export;

import java.util.Locale;
import neurotest.core.error.UnsupportedFormatException;

/**
 * Export targets, with the details a save dialog needs.
 */
public enum ExportFormat {
    JSON("json", "JSON Format", ".json", "Native format (editable)", "JSON files"),
    EEGLAB("eeglab", "EEGLAB Event List", ".txt", "Tab-delimited event markers for EEGLAB", "EEGLAB files"),
    EPRIME("eprime", "E-Prime Format", ".txt", "Tab-delimited format for E-Prime", "E-Prime files"),
    MARKER_CSV("csv", "Marker Code CSV", ".csv", "Onset, duration and trigger code per event", "CSV files"),
    BIDS_TSV("bids", "BIDS Events", ".tsv", "BIDS-style events table, times in seconds", "BIDS event files");

    private final String id;
    private final String displayName;
    private final String extension;
    private final String description;
    private final String filterLabel;

    ExportFormat(String id, String displayName, String extension, String description, String filterLabel) {
        this.id = id;
        this.displayName = displayName;
        this.extension = extension;
        this.description = description;
        this.filterLabel = filterLabel;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public String getExtension() { return extension; }
    public String getDescription() { return description; }
    public String getFilterLabel() { return filterLabel; }
    public String getFilterPattern() { return "*" + extension; }

    public TimelineFormatter formatter() {
        switch (this) {
            case EEGLAB: return new EeglabFormatter();
            case EPRIME: return new EprimeFormatter();
            case MARKER_CSV: return new MarkerCsvFormatter();
            case BIDS_TSV: return new BidsEventsFormatter();
            case JSON:
            default: return new NativeJsonFormatter();
        }
    }

    /**
     * Case-insensitive lookup by selector id ({@code json}, {@code eeglab}, ...).
     *
     * @throws UnsupportedFormatException if nothing matches
     */
    public static ExportFormat fromId(String id) {
        if (id != null) {
            String wanted = id.trim().toLowerCase(Locale.ROOT);
            for (ExportFormat f : values()) {
                if (f.id.equals(wanted)) return f;
            }
        }
        throw new UnsupportedFormatException(id);
    }
}
