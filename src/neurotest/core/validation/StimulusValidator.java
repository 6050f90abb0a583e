package neurotest.core.validation;

import java.util.ArrayList;
import java.util.List;
import neurotest.core.error.ValidationException;
import neurotest.core.model.AudioPayload;
import neurotest.core.model.StimulusEvent;
import neurotest.core.model.StimulusPayload;
import neurotest.core.model.Timeline;

/**
 * Range checks for stimuli. {@link Timeline#addEvent} trusts its caller, so
 * editors run these before inserting or retiming.
 */
public final class StimulusValidator {
    public static final int MIN_MARKER_CODE = 1;
    public static final int MAX_MARKER_CODE = 255;

    private StimulusValidator() {
    }

    public static void validate(StimulusEvent event) {
        List<String> violations = check(event);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    public static boolean isValid(StimulusEvent event) {
        return check(event).isEmpty();
    }

    /**
     * Validates every event, reporting all problems at once prefixed with the
     * event's position.
     */
    public static void validateAll(Timeline timeline) {
        List<String> violations = new ArrayList<>();
        int index = 0;
        for (StimulusEvent event : timeline.getEvents()) {
            for (String v : check(event)) {
                violations.add("event " + index + ": " + v);
            }
            index++;
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    public static void validateTiming(long onsetMs, long durationMs) {
        List<String> violations = new ArrayList<>();
        checkTiming(onsetMs, durationMs, violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    /**
     * @return every violation, empty when the event is valid
     */
    public static List<String> check(StimulusEvent event) {
        List<String> violations = new ArrayList<>();
        checkTiming(event.getOnsetMs(), event.getDurationMs(), violations);

        StimulusPayload payload = event.getPayload();
        if (payload.getFilePath() == null || payload.getFilePath().isBlank()) {
            violations.add("file path is required");
        }
        if (payload instanceof AudioPayload) {
            double volume = ((AudioPayload) payload).getVolume();
            if (Double.isNaN(volume) || volume < 0.0 || volume > 1.0) {
                violations.add("volume must be between 0 and 1, was " + volume);
            }
        }
        Integer code = payload.getMarkerCode();
        if (code != null && (code < MIN_MARKER_CODE || code > MAX_MARKER_CODE)) {
            violations.add("marker code must be between " + MIN_MARKER_CODE + " and " + MAX_MARKER_CODE + ", was " + code);
        }
        return violations;
    }

    private static void checkTiming(long onsetMs, long durationMs, List<String> violations) {
        if (onsetMs < 0) {
            violations.add("onset must be >= 0 ms, was " + onsetMs);
        }
        if (durationMs <= 0) {
            violations.add("duration must be > 0 ms, was " + durationMs);
        }
    }
}
