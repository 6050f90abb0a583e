package neurotest.core.model;

/**
 * Screen anchor for an image stimulus.
 */
public enum ImagePosition {
    CENTER("center"),
    TOP_LEFT("top-left"),
    TOP_RIGHT("top-right"),
    BOTTOM_LEFT("bottom-left"),
    BOTTOM_RIGHT("bottom-right");

    private final String wireName;

    ImagePosition(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() { return wireName; }

    public static ImagePosition fromWireName(String name) {
        for (ImagePosition p : values()) {
            if (p.wireName.equals(name)) return p;
        }
        return null;
    }
}
