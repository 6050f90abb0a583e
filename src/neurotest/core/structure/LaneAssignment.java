package neurotest.core.structure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import neurotest.core.model.StimulusEvent;
import neurotest.core.model.Timeline;

/**
 * Packs events into the fewest rows such that no row holds two overlapping
 * events (greedy interval partitioning).
 * <p>
 * Events are taken in onset order, ties in input order, and each goes to the
 * first lane, by creation order, that is free at its onset. An event ending
 * exactly where the next begins does not overlap it. Deterministic for a given
 * input order, so a re-render keeps every event on the same row.
 * O(n * lanes), fine for the tens to hundreds of events in a test.
 */
public final class LaneAssignment {

    private LaneAssignment() {
    }

    public static List<Lane> assign(Timeline timeline) {
        return assign(timeline.getEvents());
    }

    public static List<Lane> assign(List<StimulusEvent> events) {
        List<StimulusEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingLong(StimulusEvent::getOnsetMs));

        List<Lane> lanes = new ArrayList<>();
        for (StimulusEvent event : sorted) {
            Lane target = null;
            for (Lane lane : lanes) {
                if (lane.accepts(event)) {
                    target = lane;
                    break;
                }
            }
            if (target == null) {
                target = new Lane(lanes.size());
                lanes.add(target);
            }
            target.place(event);
        }
        return lanes;
    }

    /**
     * Largest number of events overlapping at any instant, with intervals
     * treated as [onset, end). Equals the lane count {@link #assign} produces.
     */
    public static int peakOverlap(List<StimulusEvent> events) {
        int n = events.size();
        long[] starts = new long[n];
        long[] ends = new long[n];
        for (int i = 0; i < n; i++) {
            starts[i] = events.get(i).getOnsetMs();
            ends[i] = events.get(i).getEndMs();
        }
        Arrays.sort(starts);
        Arrays.sort(ends);

        int peak = 0;
        int open = 0;
        int e = 0;
        for (int s = 0; s < n; s++) {
            // close everything that ended at or before this start
            while (e < n && ends[e] <= starts[s]) {
                open--;
                e++;
            }
            open++;
            peak = Math.max(peak, open);
        }
        return peak;
    }
}
