package neurotest.core.render;

import java.util.Arrays;
import java.util.List;
import neurotest.core.model.StimulusEvent;
import neurotest.core.model.StimulusKind;
import neurotest.core.model.Timeline;
import neurotest.core.structure.Lane;
import neurotest.core.structure.LaneAssignment;

/**
 * Plain-text view of a timeline: one bar row per lane, scaled to
 * {@code width} columns ({@code #} image, {@code ~} audio), followed by a
 * legend line per event.
 */
public class TimelineTextRenderer {
    private final int width;

    public TimelineTextRenderer(int width) {
        if (width < 10) {
            throw new IllegalArgumentException("width must be at least 10, was " + width);
        }
        this.width = width;
    }

    public String render(Timeline timeline) {
        StringBuilder sb = new StringBuilder();
        long total = timeline.getDurationMs();
        sb.append("Timeline (0ms to ").append(total).append("ms): ")
          .append(timeline.getMetadata().getName()).append('\n');
        if (timeline.isEmpty() || total <= 0) {
            sb.append("(no events)\n");
            return sb.toString();
        }

        List<Lane> lanes = LaneAssignment.assign(timeline);
        String rule = "=".repeat(width + 6);
        sb.append(rule).append('\n');
        for (Lane lane : lanes) {
            char[] row = new char[width];
            Arrays.fill(row, ' ');
            for (StimulusEvent e : lane.getEvents()) {
                int from = column(e.getOnsetMs(), total);
                int to = Math.max(from + 1, column(e.getEndMs(), total));
                for (int i = from; i < Math.min(to, width); i++) {
                    row[i] = e.getKind() == StimulusKind.IMAGE ? '#' : '~';
                }
            }
            sb.append(String.format("L%-3d|", lane.getIndex() + 1)).append(row).append("|\n");
        }
        sb.append(rule).append('\n');

        for (Lane lane : lanes) {
            for (StimulusEvent e : lane.getEvents()) {
                sb.append(String.format("L%-3d %-5s %s  %dms -> %dms\n",
                        lane.getIndex() + 1,
                        e.getKind().getWireName(),
                        e.getPayload().getFileName(),
                        e.getOnsetMs(),
                        e.getEndMs()));
            }
        }
        return sb.toString();
    }

    private int column(long ms, long total) {
        return (int) Math.min(width, (ms * width) / total);
    }
}
