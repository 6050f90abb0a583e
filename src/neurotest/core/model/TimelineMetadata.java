package neurotest.core.model;

/**
 * Test-level information. The duration is owned by the {@link Timeline}
 * and only recomputed there.
 */
public class TimelineMetadata {
    public static final String DEFAULT_NAME = "Untitled Test";

    private String name = DEFAULT_NAME;
    private String description = "";
    private long durationMs = 0;

    public String getName() { return name; }
    public void setName(String name) { this.name = name != null ? name : ""; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description != null ? description : ""; }

    public long getDurationMs() { return durationMs; }
    void setDurationMs(long durationMs) { this.durationMs = durationMs; }
}
