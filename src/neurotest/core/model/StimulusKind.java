package neurotest.core.model;

/**
 * Modality of a stimulus. The wire name is what appears as {@code event_type}
 * in saved tests and exports.
 */
public enum StimulusKind {
    IMAGE("image"),
    AUDIO("audio");

    private final String wireName;

    StimulusKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() { return wireName; }

    /**
     * @return the kind for {@code name}, or null if nothing matches
     */
    public static StimulusKind fromWireName(String name) {
        for (StimulusKind kind : values()) {
            if (kind.wireName.equals(name)) return kind;
        }
        return null;
    }
}
