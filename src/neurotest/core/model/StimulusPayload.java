package neurotest.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Kind-specific attributes of a stimulus.
 * Keys found in a saved test that this version does not understand are kept
 * in {@link #getExtras()} and written back unchanged.
 */
public abstract class StimulusPayload {
    public static final int DEFAULT_MARKER_CODE = 1;

    private String filePath;
    private Integer markerCode;
    private final Map<String, JsonNode> extras = new LinkedHashMap<>();

    protected StimulusPayload(String filePath) {
        this.filePath = filePath;
    }

    public abstract StimulusKind getKind();

    public abstract StimulusPayload copy();

    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }

    public String getFileName() {
        return fileNameOf(filePath);
    }

    /**
     * Last segment of {@code path}, either separator style; empty for null.
     */
    public static String fileNameOf(String path) {
        if (path == null) return "";
        int cut = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return cut >= 0 ? path.substring(cut + 1) : path;
    }

    /**
     * @return the marker code as stored, null when none was given
     */
    public Integer getMarkerCode() { return markerCode; }
    public void setMarkerCode(Integer markerCode) { this.markerCode = markerCode; }

    public int getEffectiveMarkerCode() {
        return markerCode != null ? markerCode : DEFAULT_MARKER_CODE;
    }

    public Map<String, JsonNode> getExtras() { return extras; }

    protected void copyCommonInto(StimulusPayload target) {
        target.markerCode = this.markerCode;
        for (Map.Entry<String, JsonNode> e : extras.entrySet()) {
            target.extras.put(e.getKey(), e.getValue().deepCopy());
        }
    }
}
