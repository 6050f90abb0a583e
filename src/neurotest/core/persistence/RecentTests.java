package neurotest.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import neurotest.core.config.TestMakerSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Most-recently-opened test files, newest first, stored as
 * {@code {"recent_tests": [...]}} in {@code recent.json}.
 */
public class RecentTests {
    private static final Logger logger = LogManager.getLogger(RecentTests.class);

    static final String FILE_NAME = "recent.json";
    static final String KEY = "recent_tests";

    private final TimelineStorage storage;
    private final Path configDir;
    private final int limit;

    public RecentTests(TimelineStorage storage, TestMakerSettings settings) {
        this(storage, settings.getConfigDir(), settings.getRecentLimit());
    }

    public RecentTests(TimelineStorage storage, Path configDir, int limit) {
        this.storage = storage;
        this.configDir = configDir;
        this.limit = limit;
    }

    /**
     * Entries whose files have since disappeared are left out.
     * An unreadable list is treated as empty.
     */
    public List<Path> list() {
        Path file = configDir.resolve(FILE_NAME);
        List<Path> result = new ArrayList<>();
        if (!storage.exists(file)) return result;

        JsonNode root;
        try {
            root = TimelineCodec.mapper().readTree(storage.read(file));
        } catch (IOException e) {
            logger.warn("Ignoring unreadable recent tests list {}: {}", file, e.getMessage());
            return result;
        }
        JsonNode entries = root.path(KEY);
        for (JsonNode entry : entries) {
            if (!entry.isTextual()) continue;
            Path p;
            try {
                p = Paths.get(entry.textValue());
            } catch (InvalidPathException e) {
                logger.warn("Skipping malformed recent test entry in {}: {}", file, e.getMessage());
                continue;
            }
            if (storage.exists(p)) {
                result.add(p);
            }
        }
        return result;
    }

    /**
     * Moves {@code test} to the front, dropping duplicates and anything past the limit.
     */
    public void record(Path test) throws IOException {
        List<Path> recent = new ArrayList<>();
        recent.add(test);
        for (Path p : list()) {
            if (!p.equals(test)) recent.add(p);
        }
        while (recent.size() > limit) {
            recent.remove(recent.size() - 1);
        }

        ObjectNode root = TimelineCodec.mapper().createObjectNode();
        ArrayNode entries = root.putArray(KEY);
        for (Path p : recent) {
            entries.add(p.toString());
        }
        storage.createDirectories(configDir);
        try {
            storage.write(configDir.resolve(FILE_NAME), TimelineCodec.mapper().writeValueAsString(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize recent tests", e);
        }
    }
}
