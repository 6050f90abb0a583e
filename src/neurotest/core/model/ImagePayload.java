package neurotest.core.model;

import java.util.Objects;

public class ImagePayload extends StimulusPayload {
    private ImagePosition position;

    public ImagePayload(String filePath) {
        this(filePath, ImagePosition.CENTER);
    }

    public ImagePayload(String filePath, ImagePosition position) {
        super(filePath);
        this.position = Objects.requireNonNull(position, "position");
    }

    @Override
    public StimulusKind getKind() { return StimulusKind.IMAGE; }

    public ImagePosition getPosition() { return position; }
    public void setPosition(ImagePosition position) { this.position = Objects.requireNonNull(position, "position"); }

    @Override
    public ImagePayload copy() {
        ImagePayload clone = new ImagePayload(getFilePath(), position);
        copyCommonInto(clone);
        return clone;
    }
}
