package pl.marcinmilkowski.drama_network.export;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Semicolon-separated tables.
 */
public final class CsvFormat {

    public static final char SEPARATOR = ';';

    private CsvFormat() {
    }

    /**
     * Quote a field that contains the separator, a quote or a line break.
     */
    public static String escape(Object value) {
        if (value == null) return "";
        String s = value.toString();
        if (s.indexOf(SEPARATOR) >= 0 || s.indexOf('"') >= 0 || s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }

    public static void writeRow(Writer out, List<?> fields) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) line.append(SEPARATOR);
            line.append(escape(fields.get(i)));
        }
        line.append('\n');
        out.write(line.toString());
    }

    /**
     * File name component: anything but letters, digits, '.', '-' and '_' becomes '_'.
     */
    public static String safeFileName(String s) {
        return s.replaceAll("[^\\p{L}\\p{N}._-]", "_");
    }
}
