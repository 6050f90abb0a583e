package neurotest.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import neurotest.core.persistence.LocalFileStorage;
import neurotest.core.persistence.TestFileManager;
import neurotest.core.persistence.TimelineCodec;
import neurotest.core.persistence.TimelineStorage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Pure data model for a stimulus test.
 * Events are kept sorted by onset (stable, so equal onsets stay in insertion
 * order) and the metadata duration always matches the latest event end.
 * Both hold again by the time any mutator returns.
 * <p>
 * Not thread safe. A playback loop polling {@link #getEventsAt} while an
 * editor mutates needs its own mutual exclusion.
 */
public class Timeline {
    private static final Logger logger = LogManager.getLogger(Timeline.class);

    private static final Comparator<StimulusEvent> BY_ONSET = Comparator.comparingLong(StimulusEvent::getOnsetMs);

    private final List<StimulusEvent> events = new ArrayList<>();
    private final TimelineMetadata metadata = new TimelineMetadata();

    private final AtomicLong revision = new AtomicLong(0);

    public interface TimelineListener {
        void onTimelineUpdated(Timeline timeline);
    }
    private final List<TimelineListener> listeners = new CopyOnWriteArrayList<>();

    public Timeline() {
    }

    // --- Event Management ---

    /**
     * Inserts without range checks; callers run the validator first.
     * Overlapping events are legal.
     */
    public void addEvent(StimulusEvent event) {
        events.add(event);
        logger.debug("Added {}", event);
        afterMutation();
    }

    public void addEvents(Collection<StimulusEvent> toAdd) {
        if (toAdd.isEmpty()) return;
        events.addAll(toAdd);
        logger.debug("Added {} events", toAdd.size());
        afterMutation();
    }

    /**
     * Removes by id. Does nothing if the event is not on this timeline.
     */
    public void removeEvent(StimulusEvent event) {
        boolean removed = events.removeIf(e -> e.getId() == event.getId());
        if (removed) {
            logger.debug("Removed {}", event);
            afterMutation();
        }
    }

    /**
     * Moves or resizes an event and restores ordering and duration.
     *
     * @throws IllegalArgumentException if the event is not on this timeline
     */
    public void retimeEvent(StimulusEvent event, long onsetMs, long durationMs) {
        StimulusEvent owned = findById(event.getId());
        if (owned == null) {
            throw new IllegalArgumentException("Event " + event.getId() + " is not on this timeline");
        }
        owned.setOnsetMs(onsetMs);
        owned.setDurationMs(durationMs);
        logger.debug("Retimed {}", owned);
        afterMutation();
    }

    public void clear() {
        events.clear();
        afterMutation();
    }

    /**
     * @return a snapshot in timeline order
     */
    public List<StimulusEvent> getEvents() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public StimulusEvent findById(long id) {
        for (StimulusEvent e : events) {
            if (e.getId() == id) return e;
        }
        return null;
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    // --- Queries ---

    public List<StimulusEvent> getEventsAt(long timeMs) {
        return getEventsAt(timeMs, 0);
    }

    /**
     * Every event whose [onset - tolerance, end + tolerance] contains
     * {@code timeMs}, in timeline order.
     */
    public List<StimulusEvent> getEventsAt(long timeMs, long toleranceMs) {
        List<StimulusEvent> active = new ArrayList<>();
        for (StimulusEvent e : events) {
            if (e.isActiveAt(timeMs, toleranceMs)) {
                active.add(e);
            }
        }
        return active;
    }

    // --- Metadata ---

    public TimelineMetadata getMetadata() {
        return metadata;
    }

    public long getDurationMs() {
        return metadata.getDurationMs();
    }

    // --- Serialization ---

    public ObjectNode toSerializable() {
        return TimelineCodec.encode(this);
    }

    /**
     * Builds a new timeline; nothing is returned if any part of {@code data}
     * is malformed.
     *
     * @throws neurotest.core.error.FormatException on missing or mistyped keys
     */
    public static Timeline fromSerializable(JsonNode data) {
        return TimelineCodec.decode(data);
    }

    public void save(Path path) throws IOException {
        save(path, new LocalFileStorage());
    }

    public void save(Path path, TimelineStorage storage) throws IOException {
        new TestFileManager(storage).save(this, path);
    }

    public static Timeline load(Path path) throws IOException {
        return load(path, new LocalFileStorage());
    }

    public static Timeline load(Path path, TimelineStorage storage) throws IOException {
        return new TestFileManager(storage).load(path);
    }

    // --- Revision ---

    /**
     * Bumped on every mutation; renderers compare it to skip re-layout.
     */
    public long getRevision() {
        return revision.get();
    }

    // --- Listeners ---

    public void addListener(TimelineListener l) {
        listeners.add(l);
    }

    public void removeListener(TimelineListener l) {
        listeners.remove(l);
    }

    private void afterMutation() {
        events.sort(BY_ONSET);
        metadata.setDurationMs(computeDuration());
        revision.incrementAndGet();
        for (TimelineListener l : listeners) {
            l.onTimelineUpdated(this);
        }
    }

    private long computeDuration() {
        if (events.isEmpty()) return 0;
        long max = Long.MIN_VALUE;
        for (StimulusEvent e : events) {
            long end = e.getEndMs();
            if (end > max) max = end;
        }
        return max;
    }
}
