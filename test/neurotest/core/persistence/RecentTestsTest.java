package neurotest.core.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecentTestsTest {
    private static final Path CONFIG = Paths.get("/home/user/.neuroscience_test_maker");
    private static final Path TESTS = Paths.get("/data/tests");

    private InMemoryStorage storage;
    private RecentTests recent;

    @BeforeEach
    void setUp() throws Exception {
        storage = new InMemoryStorage();
        storage.createDirectories(TESTS);
        for (int i = 0; i < 15; i++) {
            storage.write(test(i), "{}");
        }
        recent = new RecentTests(storage, CONFIG, 10);
    }

    private static Path test(int i) {
        return TESTS.resolve("test" + i + ".json");
    }

    @Test
    void emptyWhenNothingRecorded() {
        assertThat(recent.list()).isEmpty();
    }

    @Test
    void recordCreatesConfigDirectoryAndFile() throws Exception {
        recent.record(test(0));

        String content = storage.contentOf(CONFIG.resolve("recent.json"));
        assertThat(content).contains("\"recent_tests\"").contains("test0.json");
        assertThat(recent.list()).containsExactly(test(0));
    }

    @Test
    void newestFirstWithoutDuplicates() throws Exception {
        recent.record(test(1));
        recent.record(test(2));
        recent.record(test(1));

        assertThat(recent.list()).containsExactly(test(1), test(2));
    }

    @Test
    void keepsOnlyTheLimit() throws Exception {
        for (int i = 0; i < 15; i++) {
            recent.record(test(i));
        }

        assertThat(recent.list()).hasSize(10).startsWith(test(14)).endsWith(test(5));
    }

    @Test
    void dropsEntriesWhoseFilesAreGone() throws Exception {
        recent.record(test(3));
        recent.record(test(4));
        storage.delete(test(3));

        assertThat(recent.list()).containsExactly(test(4));
    }

    @Test
    void malformedEntriesAreSkipped() throws Exception {
        storage.createDirectories(CONFIG);
        storage.write(CONFIG.resolve("recent.json"),
                "{\"recent_tests\": [\"/data/tests/bad\\u0000name.json\", 42, \"" + test(2) + "\"]}");

        assertThat(recent.list()).containsExactly(test(2));
    }

    @Test
    void corruptListIsTreatedAsEmpty() throws Exception {
        storage.createDirectories(CONFIG);
        storage.write(CONFIG.resolve("recent.json"), "not json at all [");

        assertThat(recent.list()).isEmpty();
        recent.record(test(7));
        assertThat(recent.list()).containsExactly(test(7));
    }
}
