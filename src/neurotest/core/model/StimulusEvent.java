package neurotest.core.model;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One scheduled stimulus occurrence on a test timeline.
 * Pure data, agnostic to whatever presents it.
 * <p>
 * Timing is changed through {@link Timeline#retimeEvent} so the owning
 * timeline can restore its ordering and duration.
 */
public class StimulusEvent {
    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private long onsetMs;
    private long durationMs;
    private final StimulusPayload payload;

    public StimulusEvent(long onsetMs, long durationMs, StimulusPayload payload) {
        this.id = NEXT_ID.getAndIncrement();
        this.onsetMs = onsetMs;
        this.durationMs = durationMs;
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public static StimulusEvent image(long onsetMs, long durationMs, String filePath) {
        return new StimulusEvent(onsetMs, durationMs, new ImagePayload(filePath));
    }

    public static StimulusEvent image(long onsetMs, long durationMs, String filePath, ImagePosition position) {
        return new StimulusEvent(onsetMs, durationMs, new ImagePayload(filePath, position));
    }

    public static StimulusEvent audio(long onsetMs, long durationMs, String filePath) {
        return new StimulusEvent(onsetMs, durationMs, new AudioPayload(filePath));
    }

    public static StimulusEvent audio(long onsetMs, long durationMs, String filePath, double volume) {
        return new StimulusEvent(onsetMs, durationMs, new AudioPayload(filePath, volume));
    }

    public long getId() { return id; }

    public StimulusKind getKind() { return payload.getKind(); }

    public long getOnsetMs() { return onsetMs; }
    void setOnsetMs(long onsetMs) { this.onsetMs = onsetMs; }

    public long getDurationMs() { return durationMs; }
    void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    /** Last instant at which the event is still active. */
    public long getEndMs() { return onsetMs + durationMs; }

    public StimulusPayload getPayload() { return payload; }

    /**
     * Inclusive on both ends, widened by {@code toleranceMs} on each side.
     */
    public boolean isActiveAt(long timeMs, long toleranceMs) {
        return onsetMs - toleranceMs <= timeMs && timeMs <= getEndMs() + toleranceMs;
    }

    /**
     * Same timing and payload under a fresh id.
     */
    public StimulusEvent copy() {
        return new StimulusEvent(onsetMs, durationMs, payload.copy());
    }

    @Override
    public String toString() {
        return getKind().getWireName() + "#" + id + "[" + onsetMs + "ms+" + durationMs + "ms " + payload.getFilePath() + "]";
    }
}
