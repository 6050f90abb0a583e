package neurotest.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Locations and limits.
 * Values come from {@code neurotest.properties} on the classpath, then from
 * {@code neurotest.*} system properties.
 */
public class TestMakerSettings {
    private static final Logger logger = LogManager.getLogger(TestMakerSettings.class);

    public static final String RESOURCE = "neurotest.properties";
    static final String PREFIX = "neurotest.";

    private int recentLimit = 10;
    private Path configDir = Paths.get(System.getProperty("user.home"), ".neuroscience_test_maker");
    private int toneSampleRate = 44100;

    public int getRecentLimit() { return recentLimit; }
    public void setRecentLimit(int limit) { this.recentLimit = limit; }

    public Path getConfigDir() { return configDir; }
    public void setConfigDir(Path dir) { this.configDir = dir; }

    public int getToneSampleRate() { return toneSampleRate; }
    public void setToneSampleRate(int rate) { this.toneSampleRate = rate; }

    public static TestMakerSettings load() {
        Properties props = new Properties();
        try (InputStream in = TestMakerSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using built-in defaults", RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                props.setProperty(key.substring(PREFIX.length()), System.getProperty(key));
            }
        }
        return fromProperties(props);
    }

    /**
     * Keys are unprefixed ({@code recent.limit}, not
     * {@code neurotest.recent.limit}). Unparseable values are
     * reported and skipped.
     */
    public static TestMakerSettings fromProperties(Properties props) {
        TestMakerSettings s = new TestMakerSettings();
        String v;
        if ((v = props.getProperty("recent.limit")) != null) {
            try { s.recentLimit = Integer.parseInt(v.trim()); } catch (NumberFormatException e) { invalid("recent.limit", v); }
        }
        if ((v = props.getProperty("config.dir")) != null && !v.isBlank()) {
            s.configDir = Paths.get(v.trim());
        }
        if ((v = props.getProperty("tone.sample.rate")) != null) {
            try { s.toneSampleRate = Integer.parseInt(v.trim()); } catch (NumberFormatException e) { invalid("tone.sample.rate", v); }
        }
        return s;
    }

    private static void invalid(String key, String value) {
        logger.warn("Ignoring invalid setting {}={}", key, value);
    }
}
