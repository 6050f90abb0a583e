package neurotest.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

class StimulusEventTest {

    @Test
    void idsAreUniqueAndStable() {
        StimulusEvent a = StimulusEvent.image(0, 100, "a.png");
        StimulusEvent b = StimulusEvent.image(0, 100, "a.png");

        assertThat(a.getId()).isNotEqualTo(b.getId());
        long before = a.getId();
        a.getPayload().setFilePath("renamed.png");
        assertThat(a.getId()).isEqualTo(before);
    }

    @Test
    void kindFollowsPayload() {
        assertThat(StimulusEvent.image(0, 1, "a.png").getKind()).isEqualTo(StimulusKind.IMAGE);
        assertThat(StimulusEvent.audio(0, 1, "a.wav").getKind()).isEqualTo(StimulusKind.AUDIO);
    }

    @Test
    void defaultsMatchTheEditor() {
        ImagePayload image = (ImagePayload) StimulusEvent.image(0, 1, "a.png").getPayload();
        AudioPayload audio = (AudioPayload) StimulusEvent.audio(0, 1, "a.wav").getPayload();

        assertThat(image.getPosition()).isEqualTo(ImagePosition.CENTER);
        assertThat(audio.getVolume()).isEqualTo(1.0);
        assertThat(audio.getMarkerCode()).isNull();
        assertThat(audio.getEffectiveMarkerCode()).isEqualTo(1);
    }

    @Test
    void copyGetsFreshIdAndIndependentPayload() {
        StimulusEvent original = StimulusEvent.audio(100, 200, "tone.wav", 0.5);
        original.getPayload().setMarkerCode(12);
        original.getPayload().getExtras().put("note", TextNode.valueOf("practice"));

        StimulusEvent copy = original.copy();
        copy.getPayload().setFilePath("other.wav");

        assertThat(copy.getId()).isNotEqualTo(original.getId());
        assertThat(copy.getOnsetMs()).isEqualTo(100);
        assertThat(copy.getDurationMs()).isEqualTo(200);
        assertThat(((AudioPayload) copy.getPayload()).getVolume()).isEqualTo(0.5);
        assertThat(copy.getPayload().getMarkerCode()).isEqualTo(12);
        assertThat(copy.getPayload().getExtras()).containsEntry("note", TextNode.valueOf("practice"));
        assertThat(original.getPayload().getFilePath()).isEqualTo("tone.wav");
    }

    @Test
    void fileNameHandlesBothSeparators() {
        assertThat(StimulusEvent.image(0, 1, "/stim/img/cat.png").getPayload().getFileName()).isEqualTo("cat.png");
        assertThat(StimulusEvent.image(0, 1, "C:\\stim\\dog.jpg").getPayload().getFileName()).isEqualTo("dog.jpg");
        assertThat(StimulusEvent.image(0, 1, "bare.png").getPayload().getFileName()).isEqualTo("bare.png");
        assertThat(StimulusPayload.fileNameOf("mixed/dir\\tone.wav")).isEqualTo("tone.wav");
        assertThat(StimulusPayload.fileNameOf("trailing/")).isEmpty();
        assertThat(StimulusPayload.fileNameOf(null)).isEmpty();
    }

    @Test
    void wireNamesRoundTrip() {
        for (StimulusKind kind : StimulusKind.values()) {
            assertThat(StimulusKind.fromWireName(kind.getWireName())).isEqualTo(kind);
        }
        for (ImagePosition p : ImagePosition.values()) {
            assertThat(ImagePosition.fromWireName(p.getWireName())).isEqualTo(p);
        }
        assertThat(StimulusKind.fromWireName("video")).isNull();
        assertThat(ImagePosition.fromWireName("middle")).isNull();
    }
}
