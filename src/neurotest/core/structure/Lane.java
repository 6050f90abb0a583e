package neurotest.core.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import neurotest.core.model.StimulusEvent;

/**
 * One row of a lane layout. Events in a lane never overlap and are in onset order.
 */
public class Lane {
    private final int index;
    private final List<StimulusEvent> events = new ArrayList<>();
    private long freeAtMs = Long.MIN_VALUE;

    Lane(int index) {
        this.index = index;
    }

    public int getIndex() { return index; }

    public List<StimulusEvent> getEvents() { return Collections.unmodifiableList(events); }

    /** End of the last event placed here. */
    public long getFreeAtMs() { return freeAtMs; }

    boolean accepts(StimulusEvent event) {
        return event.getOnsetMs() >= freeAtMs;
    }

    void place(StimulusEvent event) {
        events.add(event);
        freeAtMs = event.getEndMs();
    }
}
