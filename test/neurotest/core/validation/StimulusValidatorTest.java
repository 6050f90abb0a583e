package neurotest.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import neurotest.core.error.ValidationException;
import neurotest.core.model.StimulusEvent;
import neurotest.core.model.Timeline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StimulusValidatorTest {

    @Test
    void acceptsWellFormedEvents() {
        assertThat(StimulusValidator.check(StimulusEvent.image(0, 1, "i.png"))).isEmpty();
        assertThat(StimulusValidator.isValid(StimulusEvent.audio(10, 500, "a.wav", 0.0))).isTrue();
        assertThat(StimulusValidator.isValid(StimulusEvent.audio(10, 500, "a.wav", 1.0))).isTrue();
    }

    @Test
    void rejectsNegativeOnsetAndEmptyDuration() {
        StimulusEvent event = StimulusEvent.image(-5, 0, "i.png");

        assertThat(StimulusValidator.check(event)).containsExactly(
                "onset must be >= 0 ms, was -5",
                "duration must be > 0 ms, was 0");
    }

    @Test
    void requiresAFilePath() {
        assertThat(StimulusValidator.check(StimulusEvent.image(0, 10, null))).containsExactly("file path is required");
        assertThat(StimulusValidator.check(StimulusEvent.audio(0, 10, "  "))).containsExactly("file path is required");
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01, Double.NaN})
    void rejectsVolumeOutsideUnitRange(double volume) {
        assertThat(StimulusValidator.check(StimulusEvent.audio(0, 10, "a.wav", volume)))
                .singleElement().asString().startsWith("volume must be between 0 and 1");
    }

    @Test
    void markerCodeMustFitInAByte() {
        StimulusEvent event = StimulusEvent.image(0, 10, "i.png");

        event.getPayload().setMarkerCode(255);
        assertThat(StimulusValidator.isValid(event)).isTrue();
        event.getPayload().setMarkerCode(256);
        assertThat(StimulusValidator.check(event)).containsExactly("marker code must be between 1 and 255, was 256");
        event.getPayload().setMarkerCode(0);
        assertThat(StimulusValidator.isValid(event)).isFalse();
        event.getPayload().setMarkerCode(null);
        assertThat(StimulusValidator.isValid(event)).isTrue();
    }

    @Test
    void validateThrowsWithEveryViolation() {
        StimulusEvent event = StimulusEvent.audio(-1, -1, "", 2.0);

        assertThatThrownBy(() -> StimulusValidator.validate(event))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getViolations()).hasSize(4))
                .hasMessageStartingWith("Invalid stimulus: ");
    }

    @Test
    void validateAllPrefixesTheEventPosition() {
        Timeline timeline = new Timeline();
        timeline.addEvent(StimulusEvent.image(0, 100, "ok.png"));
        timeline.addEvent(StimulusEvent.audio(200, 0, "short.wav"));

        assertThatThrownBy(() -> StimulusValidator.validateAll(timeline))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getViolations()).containsExactly("event 1: duration must be > 0 ms, was 0"));
    }

    @Test
    void validateTimingChecksOnlyTiming() {
        assertThatCode(() -> StimulusValidator.validateTiming(0, 1)).doesNotThrowAnyException();
        assertThatThrownBy(() -> StimulusValidator.validateTiming(0, 0)).isInstanceOf(ValidationException.class);
    }
}
