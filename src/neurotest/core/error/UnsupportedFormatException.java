package neurotest.core.error;

/**
 * An export format selector that matches no known formatter.
 */
public class UnsupportedFormatException extends TimelineException {
    private final String selector;

    public UnsupportedFormatException(String selector) {
        super("Unsupported export format: " + selector);
        this.selector = selector;
    }

    public String getSelector() {
        return selector;
    }
}
