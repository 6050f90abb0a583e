package neurotest.core.error;

/**
 * Root of the failures raised by the timeline core.
 * Filesystem problems are reported separately as {@link java.io.IOException}.
 */
public class TimelineException extends RuntimeException {

    public TimelineException(String message) {
        super(message);
    }

    public TimelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
