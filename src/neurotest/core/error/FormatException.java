package neurotest.core.error;

/**
 * Malformed or incomplete structured data on load.
 */
public class FormatException extends TimelineException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
