package neurotest.core.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import neurotest.core.error.FormatException;
import neurotest.core.model.StimulusEvent;
import neurotest.core.model.Timeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestFileManagerTest {
    private InMemoryStorage storage;
    private TestFileManager manager;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorage();
        storage.createDirectories(Paths.get("/tests"));
        manager = new TestFileManager(storage);
    }

    private static Timeline twoEvents() {
        Timeline timeline = new Timeline();
        timeline.getMetadata().setName("Oddball");
        timeline.addEvent(StimulusEvent.audio(0, 100, "stimuli/standard.wav"));
        timeline.addEvent(StimulusEvent.audio(800, 100, "stimuli/deviant.wav", 0.6));
        return timeline;
    }

    @Test
    void saveThenLoadRestoresTheTest() throws Exception {
        Path file = Paths.get("/tests/oddball.json");

        manager.save(twoEvents(), file);
        Timeline loaded = manager.load(file);

        assertThat(storage.contentOf(file)).contains("\"file_path\"").contains("\"Oddball\"");
        assertThat(loaded.getMetadata().getName()).isEqualTo("Oddball");
        assertThat(loaded.getDurationMs()).isEqualTo(900);
        assertThat(loaded.getEvents()).extracting(e -> e.getPayload().getFileName())
                .containsExactly("standard.wav", "deviant.wav");
    }

    @Test
    void timelineSaveAndLoadGoThroughStorage() throws Exception {
        Path file = Paths.get("/tests/t.json");

        twoEvents().save(file, storage);

        assertThat(Timeline.load(file, storage).size()).isEqualTo(2);
    }

    @Test
    void saveIntoMissingDirectoryFails() {
        assertThatThrownBy(() -> manager.save(twoEvents(), Paths.get("/nowhere/t.json")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void loadingMissingFileFails() {
        assertThatThrownBy(() -> manager.load(Paths.get("/tests/absent.json")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void invalidJsonIsAFormatError() throws Exception {
        Path file = Paths.get("/tests/broken.json");
        storage.write(file, "{\"metadata\": {\"name\": ");

        assertThatThrownBy(() -> manager.load(file))
                .isInstanceOf(FormatException.class)
                .hasMessageStartingWith("Not valid JSON");
    }

    @Test
    void wellFormedJsonWithWrongShapeIsAFormatError() throws Exception {
        Path file = Paths.get("/tests/shape.json");
        storage.write(file, "{\"events\": [{\"event_type\": \"image\"}]}");

        assertThatThrownBy(() -> manager.load(file)).isInstanceOf(FormatException.class);
    }

    @Test
    void roundTripsThroughTheLocalDisk(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("disk.json");

        twoEvents().save(file);

        assertThat(Files.readString(file)).contains("deviant.wav");
        assertThat(Timeline.load(file).getEvents()).extracting(StimulusEvent::getOnsetMs).containsExactly(0L, 800L);
    }
}
