package neurotest.core.export;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class EprimeFormatterTest {

    @Test
    void startsWithByteOrderMark() {
        String text = new EprimeFormatter().format(ExportFixtures.fourEvents().toSerializable());

        assertThat(text.charAt(0)).isEqualTo('\uFEFF');
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        assertThat(bytes[0]).isEqualTo((byte) 0xEF);
        assertThat(bytes[1]).isEqualTo((byte) 0xBB);
        assertThat(bytes[2]).isEqualTo((byte) 0xBF);
    }

    @Test
    void headerTableAndFooter() {
        String text = new EprimeFormatter().format(ExportFixtures.fourEvents().toSerializable()).substring(1);

        assertThat(text.split("\r\n")).containsExactly(
                "*** Header Start ***",
                "VersionNumber:\t1.0",
                "LevelName:\tSession",
                "Title:\tVisual Oddball",
                "Description:\tPilot run",
                "Exported:\tNeuroscience Test Maker",
                "*** Header End ***",
                "",
                "Procedure\tTrial\tStimulus\tStimulusFile\tOnsetTime\tDuration\tType\tModality",
                "TrialProc\t1\tfixation\tfixation.png\t0\t1000\timage\tIMAGE",
                "TrialProc\t2\tbeep\tbeep.wav\t250\t100\taudio\tAUDIO",
                "TrialProc\t3\ttarget\ttarget.png\t1000\t2000\timage\tIMAGE",
                "TrialProc\t4\ttone_1000Hz\ttone_1000Hz.wav\t1500\t200\taudio\tAUDIO",
                "",
                "*** End of data ***");
    }

    @Test
    void eventWithoutFileIsNamedByTypeAndTrial() {
        String text = new EprimeFormatter().format(ExportFixtures.json("{'events': ["
                + "{'event_type': 'audio', 'timestamp_ms': 0, 'data': {'duration_ms': 10}}]}"));

        assertThat(text).contains("TrialProc\t1\taudio_1\t\t0\t10\taudio\tAUDIO\r\n");
    }
}
