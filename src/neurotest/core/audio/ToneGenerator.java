package neurotest.core.audio;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import neurotest.core.error.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Generates pure sine tones as 16-bit mono PCM and writes them as WAV files,
 * ready to be used as audio stimuli.
 */
public class ToneGenerator {
    private static final Logger logger = LogManager.getLogger(ToneGenerator.class);

    public static final int DEFAULT_SAMPLE_RATE = 44100;
    public static final double DEFAULT_AMPLITUDE = 0.5;
    public static final String DEFAULT_PREFIX = "tone";

    public enum Preset {
        BASIC(100, 1000, 100),
        EXTENDED(100, 5000, 100),
        HIGH(1000, 10000, 500);

        private final double startHz;
        private final double endHz;
        private final double stepHz;

        Preset(double startHz, double endHz, double stepHz) {
            this.startHz = startHz;
            this.endHz = endHz;
            this.stepHz = stepHz;
        }

        public double getStartHz() { return startHz; }
        public double getEndHz() { return endHz; }
        public double getStepHz() { return stepHz; }
    }

    private final int sampleRate;

    public ToneGenerator() {
        this(DEFAULT_SAMPLE_RATE);
    }

    public ToneGenerator(int sampleRate) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sample rate must be positive, was " + sampleRate);
        }
        this.sampleRate = sampleRate;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    /**
     * {@code amplitude * sin(2 pi f t)} scaled to 16 bits,
     * {@code floor(sampleRate * duration)} samples long.
     */
    public short[] generateTone(double frequencyHz, double durationSeconds, double amplitude) {
        List<String> violations = new ArrayList<>();
        if (!(frequencyHz > 0)) violations.add("frequency must be positive");
        if (!(durationSeconds > 0)) violations.add("duration must be positive");
        if (!(amplitude >= 0.0 && amplitude <= 1.0)) violations.add("amplitude must be between 0.0 and 1.0");
        if (!violations.isEmpty()) throw new ValidationException(violations);

        int count = (int) (sampleRate * durationSeconds);
        short[] samples = new short[count];
        for (int i = 0; i < count; i++) {
            double t = (double) i / sampleRate;
            samples[i] = (short) (amplitude * Math.sin(2 * Math.PI * frequencyHz * t) * 32767);
        }
        return samples;
    }

    public void saveTone(short[] samples, Path file) throws IOException {
        byte[] bytes = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            bytes[2 * i] = (byte) samples[i];
            bytes[2 * i + 1] = (byte) (samples[i] >> 8);
        }
        AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
        try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(bytes), format, samples.length)) {
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, file.toFile());
        }
    }

    public Path generateSingleTone(double frequencyHz, double durationSeconds, double amplitude,
                                   Path outputDir, String prefix) throws IOException {
        short[] samples = generateTone(frequencyHz, durationSeconds, amplitude);
        Path file = outputDir.resolve(fileNameFor(prefix, frequencyHz));
        saveTone(samples, file);
        logger.info("Generated {}", file);
        return file;
    }

    /**
     * One tone per frequency from {@code startHz} to {@code endHz} inclusive.
     * The output directory is created if needed.
     *
     * @return the files written, in frequency order
     */
    public List<Path> generateFrequencyRange(double startHz, double endHz, double stepHz, double durationSeconds,
                                             Path outputDir, double amplitude, String prefix) throws IOException {
        List<String> violations = new ArrayList<>();
        if (!(startHz > 0) || !(endHz > 0) || !(stepHz > 0)) violations.add("frequencies and step must be positive");
        if (!(startHz < endHz)) violations.add("start frequency must be less than end frequency");
        if (!(durationSeconds > 0)) violations.add("duration must be positive");
        if (!(amplitude >= 0.0 && amplitude <= 1.0)) violations.add("amplitude must be between 0.0 and 1.0");
        if (!violations.isEmpty()) throw new ValidationException(violations);

        Files.createDirectories(outputDir);
        List<Path> generated = new ArrayList<>();
        // index-based so rounding in the step never skips the end frequency
        long steps = (long) Math.floor((endHz - startHz) / stepHz + 1e-6);
        for (long i = 0; i <= steps; i++) {
            double freq = startHz + i * stepHz;
            Path file = outputDir.resolve(fileNameFor(prefix, freq));
            saveTone(generateTone(freq, durationSeconds, amplitude), file);
            generated.add(file);
        }
        logger.info("Generated {} tones in {}", generated.size(), outputDir);
        return generated;
    }

    public List<Path> generatePreset(Preset preset, double durationSeconds, Path outputDir,
                                     double amplitude, String prefix) throws IOException {
        return generateFrequencyRange(preset.startHz, preset.endHz, preset.stepHz, durationSeconds,
                outputDir, amplitude, prefix);
    }

    /**
     * {@code tone_440Hz.wav} for whole frequencies, {@code tone_440.5Hz.wav} otherwise.
     */
    public static String fileNameFor(String prefix, double frequencyHz) {
        String p = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix;
        if (frequencyHz == Math.rint(frequencyHz)) {
            return p + "_" + (long) frequencyHz + "Hz.wav";
        }
        return p + "_" + String.format(Locale.ROOT, "%.1f", frequencyHz) + "Hz.wav";
    }
}
