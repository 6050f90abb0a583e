package neurotest.core.export;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;

/**
 * Row-at-a-time builder for delimited text. A field is quoted only when it
 * contains the delimiter, a double quote, CR or LF; embedded quotes are doubled.
 */
class DelimitedText {
    private final char delimiter;
    private final String lineEnd;
    private final Joiner joiner;
    private final StringBuilder out = new StringBuilder();

    DelimitedText(char delimiter, String lineEnd) {
        this.delimiter = delimiter;
        this.lineEnd = lineEnd;
        this.joiner = Joiner.on(delimiter);
    }

    DelimitedText row(Object... fields) {
        List<String> cells = new ArrayList<>(fields.length);
        for (Object f : fields) {
            cells.add(quote(f == null ? "" : String.valueOf(f)));
        }
        out.append(joiner.join(cells)).append(lineEnd);
        return this;
    }

    DelimitedText blank() {
        out.append(lineEnd);
        return this;
    }

    private String quote(String field) {
        boolean needsQuotes = field.indexOf(delimiter) >= 0 || field.indexOf('"') >= 0
                || field.indexOf('\r') >= 0 || field.indexOf('\n') >= 0;
        if (!needsQuotes) return field;
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
