package neurotest.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Path;
import neurotest.core.error.FormatException;
import neurotest.core.model.Timeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Handles saving and loading of test files (native JSON).
 */
public class TestFileManager {
    private static final Logger logger = LogManager.getLogger(TestFileManager.class);

    private final TimelineStorage storage;

    public TestFileManager(TimelineStorage storage) {
        this.storage = storage;
    }

    public void save(Timeline timeline, Path file) throws IOException {
        storage.write(file, serialize(timeline));
        logger.info("Test saved to: {}", file.toAbsolutePath());
    }

    /**
     * @throws FormatException if the file is not a well-formed test
     * @throws IOException if the file cannot be read
     */
    public Timeline load(Path file) throws IOException {
        Timeline timeline = deserialize(storage.read(file));
        logger.info("Test loaded from: {} ({} events)", file.toAbsolutePath(), timeline.size());
        return timeline;
    }

    public static String serialize(Timeline timeline) {
        try {
            return TimelineCodec.mapper().writeValueAsString(timeline.toSerializable());
        } catch (JsonProcessingException e) {
            // tree nodes always serialize; reaching here is a bug
            throw new IllegalStateException("Could not serialize timeline", e);
        }
    }

    public static Timeline deserialize(String state) {
        JsonNode root;
        try {
            root = TimelineCodec.mapper().readTree(state);
        } catch (JsonProcessingException e) {
            throw new FormatException("Not valid JSON: " + e.getOriginalMessage(), e);
        }
        return TimelineCodec.decode(root);
    }
}
