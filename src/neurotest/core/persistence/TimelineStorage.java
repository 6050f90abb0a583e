package neurotest.core.persistence;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The file-system capability the core writes and reads through.
 * Text is always UTF-8.
 */
public interface TimelineStorage {

    String read(Path path) throws IOException;

    /**
     * Replaces the file's content. The parent directory must already exist.
     */
    void write(Path path, String content) throws IOException;

    boolean exists(Path path);

    void createDirectories(Path dir) throws IOException;
}
