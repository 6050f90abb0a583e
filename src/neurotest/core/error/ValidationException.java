package neurotest.core.error;

import java.util.List;

/**
 * A stimulus field violates its documented range.
 * Carries every violation found, not just the first one.
 */
public class ValidationException extends TimelineException {
    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super("Invalid stimulus: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
