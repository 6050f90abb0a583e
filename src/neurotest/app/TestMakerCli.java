package neurotest.app;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import neurotest.core.audio.ToneGenerator;
import neurotest.core.config.TestMakerSettings;
import neurotest.core.error.TimelineException;
import neurotest.core.error.ValidationException;
import neurotest.core.export.ExportFormat;
import neurotest.core.export.TimelineExporter;
import neurotest.core.model.AudioPayload;
import neurotest.core.model.ImagePayload;
import neurotest.core.model.StimulusEvent;
import neurotest.core.model.Timeline;
import neurotest.core.persistence.LocalFileStorage;
import neurotest.core.persistence.RecentTests;
import neurotest.core.persistence.TestFileManager;
import neurotest.core.persistence.TimelineStorage;
import neurotest.core.render.TimelineTextRenderer;
import neurotest.core.validation.StimulusValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/**
 * Command-line entry point: inspect, lay out, validate and export saved tests,
 * and generate tone stimuli.
 */
@CommandLine.Command(
        name = "neurotest",
        mixinStandardHelpOptions = true,
        description = "Neuroscience Test Maker command line.",
        subcommands = {
            TestMakerCli.Inspect.class,
            TestMakerCli.Lanes.class,
            TestMakerCli.Validate.class,
            TestMakerCli.Export.class,
            TestMakerCli.Formats.class,
            TestMakerCli.Recent.class,
            TestMakerCli.Tones.class
        })
public final class TestMakerCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TestMakerCli.class);

    private final TimelineStorage storage;
    private final TestMakerSettings settings;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public TestMakerCli() {
        this(new LocalFileStorage(), TestMakerSettings.load());
    }

    public TestMakerCli(TimelineStorage storage, TestMakerSettings settings) {
        this.storage = storage;
        this.settings = settings;
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine(new TestMakerCli()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine(TestMakerCli cli) {
        return new CommandLine(cli).setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof TimelineException || ex instanceof IOException) {
                logger.debug("Command failed", ex);
                cmd.getErr().println("Error: " + describe(ex));
                return 1;
            }
            throw ex;
        });
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    Timeline open(Path file) throws IOException {
        Timeline timeline = new TestFileManager(storage).load(file);
        new RecentTests(storage, settings).record(file.toAbsolutePath());
        return timeline;
    }

    private static String describe(Exception ex) {
        if (ex instanceof NoSuchFileException) {
            return "no such file or directory: " + ex.getMessage();
        }
        return ex.getMessage();
    }

    // --- Subcommands ---

    @CommandLine.Command(name = "inspect", description = "Summarize a test, or list the stimuli active at an instant.")
    static class Inspect implements Callable<Integer> {
        @CommandLine.ParentCommand
        TestMakerCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Test file (.json).")
        Path file;

        @CommandLine.Option(names = "--at", description = "Time in ms from test start.")
        Long atMs;

        @CommandLine.Option(names = "--tolerance", defaultValue = "0", description = "Widen each event by this many ms on both sides.")
        long toleranceMs;

        @Override
        public Integer call() throws IOException {
            Timeline timeline = parent.open(file);
            PrintWriter out = spec.commandLine().getOut();
            if (atMs == null) {
                out.println("Test: " + timeline.getMetadata().getName());
                out.println("Description: " + timeline.getMetadata().getDescription());
                out.println("Duration: " + timeline.getDurationMs() + "ms");
                out.println("Events: " + timeline.size());
                for (StimulusEvent e : timeline.getEvents()) {
                    out.println("  " + e.getOnsetMs() + "ms  " + describe(e));
                }
            } else {
                List<StimulusEvent> active = timeline.getEventsAt(atMs, toleranceMs);
                out.println("At " + atMs + "ms:");
                if (active.isEmpty()) {
                    out.println("  No active stimuli");
                }
                for (StimulusEvent e : active) {
                    out.println("  - " + describe(e));
                }
            }
            out.flush();
            return 0;
        }

        private static String describe(StimulusEvent e) {
            String file = e.getPayload().getFileName();
            String detail;
            if (e.getPayload() instanceof ImagePayload) {
                detail = "position " + ((ImagePayload) e.getPayload()).getPosition().getWireName();
            } else {
                detail = "volume " + ((AudioPayload) e.getPayload()).getVolume();
            }
            return e.getKind().name() + ": " + file + " (" + e.getDurationMs() + "ms, " + detail + ")";
        }
    }

    @CommandLine.Command(name = "lanes", description = "Draw the test as non-overlapping lanes.")
    static class Lanes implements Callable<Integer> {
        @CommandLine.ParentCommand
        TestMakerCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Test file (.json).")
        Path file;

        @CommandLine.Option(names = "--width", defaultValue = "60", description = "Columns for the bar area.")
        int width;

        @Override
        public Integer call() throws IOException {
            Timeline timeline = parent.open(file);
            PrintWriter out = spec.commandLine().getOut();
            out.print(new TimelineTextRenderer(width).render(timeline));
            out.flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "validate", description = "Check every stimulus against its allowed ranges.")
    static class Validate implements Callable<Integer> {
        @CommandLine.ParentCommand
        TestMakerCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Test file (.json).")
        Path file;

        @Override
        public Integer call() throws IOException {
            Timeline timeline = parent.open(file);
            try {
                StimulusValidator.validateAll(timeline);
            } catch (ValidationException e) {
                PrintWriter err = spec.commandLine().getErr();
                for (String v : e.getViolations()) {
                    err.println(v);
                }
                err.flush();
                return 1;
            }
            spec.commandLine().getOut().println("OK: " + timeline.size() + " events valid");
            spec.commandLine().getOut().flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "export", description = "Export a test for analysis tools.")
    static class Export implements Callable<Integer> {
        @CommandLine.ParentCommand
        TestMakerCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Test file (.json).")
        Path file;

        @CommandLine.Parameters(index = "1", description = "Output file.")
        Path target;

        @CommandLine.Option(names = "--format", description = "json, eeglab, eprime, csv or bids. Default: from the output name.")
        String formatId;

        @Override
        public Integer call() throws IOException {
            Timeline timeline = parent.open(file);
            ExportFormat format = formatId != null ? ExportFormat.fromId(formatId) : TimelineExporter.detectFormat(target);
            new TimelineExporter(parent.storage).export(timeline, target, format);
            spec.commandLine().getOut().println("Exported " + timeline.size() + " events as " + format.getDisplayName() + " to " + target);
            spec.commandLine().getOut().flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "formats", description = "List export formats.")
    static class Formats implements Callable<Integer> {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            for (ExportFormat f : ExportFormat.values()) {
                out.printf("%-7s %-5s %-18s %s%n", f.getId(), f.getExtension(), f.getDisplayName(), f.getDescription());
            }
            out.flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "recent", description = "List recently opened tests.")
    static class Recent implements Callable<Integer> {
        @CommandLine.ParentCommand
        TestMakerCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            List<Path> recent = new RecentTests(parent.storage, parent.settings).list();
            if (recent.isEmpty()) {
                out.println("No recent tests");
            }
            for (int i = 0; i < recent.size(); i++) {
                out.println((i + 1) + ". " + recent.get(i));
            }
            out.flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "tones", description = "Generate sine-tone WAV stimuli.")
    static class Tones implements Callable<Integer> {
        @CommandLine.ParentCommand
        TestMakerCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Output directory.")
        Path outputDir;

        @CommandLine.Option(names = "--frequency", description = "Generate a single tone at this frequency (Hz).")
        Double frequency;

        @CommandLine.Option(names = "--preset", description = "BASIC, EXTENDED or HIGH.")
        ToneGenerator.Preset preset;

        @CommandLine.Option(names = "--start", defaultValue = "100", description = "First frequency (Hz).")
        double startHz;

        @CommandLine.Option(names = "--end", defaultValue = "1000", description = "Last frequency (Hz).")
        double endHz;

        @CommandLine.Option(names = "--step", defaultValue = "100", description = "Frequency step (Hz).")
        double stepHz;

        @CommandLine.Option(names = "--duration", defaultValue = "1.0", description = "Seconds per tone.")
        double durationSeconds;

        @CommandLine.Option(names = "--amplitude", defaultValue = "0.5", description = "0.0 to 1.0.")
        double amplitude;

        @CommandLine.Option(names = "--prefix", defaultValue = ToneGenerator.DEFAULT_PREFIX, description = "File name prefix.")
        String prefix;

        @Override
        public Integer call() throws IOException {
            ToneGenerator generator = new ToneGenerator(parent.settings.getToneSampleRate());
            List<Path> files;
            if (frequency != null) {
                Files.createDirectories(outputDir);
                files = List.of(generator.generateSingleTone(frequency, durationSeconds, amplitude, outputDir, prefix));
            } else if (preset != null) {
                files = generator.generatePreset(preset, durationSeconds, outputDir, amplitude, prefix);
            } else {
                files = generator.generateFrequencyRange(startHz, endHz, stepHz, durationSeconds, outputDir, amplitude, prefix);
            }
            PrintWriter out = spec.commandLine().getOut();
            for (Path f : files) {
                out.println(f.getFileName());
            }
            out.println("Generated " + files.size() + " tone(s) in " + outputDir);
            out.flush();
            return 0;
        }
    }
}
