package neurotest.core.model;

public class AudioPayload extends StimulusPayload {
    public static final double DEFAULT_VOLUME = 1.0;

    private double volume;

    public AudioPayload(String filePath) {
        this(filePath, DEFAULT_VOLUME);
    }

    public AudioPayload(String filePath, double volume) {
        super(filePath);
        this.volume = volume;
    }

    @Override
    public StimulusKind getKind() { return StimulusKind.AUDIO; }

    /** Playback gain, 0.0 to 1.0. Not clamped here; see the validator. */
    public double getVolume() { return volume; }
    public void setVolume(double volume) { this.volume = volume; }

    @Override
    public AudioPayload copy() {
        AudioPayload clone = new AudioPayload(getFilePath(), volume);
        copyCommonInto(clone);
        return clone;
    }
}
