package pl.marcinmilkowski.drama_network.export;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.drama_network.model.MetricValue;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CsvFormatTest {

    @Test
    @DisplayName("Fields with separators or quotes are quoted")
    void testEscape() {
        assertEquals("plain", CsvFormat.escape("plain"));
        assertEquals("\"a;b\"", CsvFormat.escape("a;b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvFormat.escape("say \"hi\""));
        assertEquals("\"two\nlines\"", CsvFormat.escape("two\nlines"));
        assertEquals("", CsvFormat.escape(null));
    }

    @Test
    @DisplayName("Rows end with a newline; undefined metrics print NaN")
    void testWriteRow() throws IOException {
        StringWriter out = new StringWriter();
        CsvFormat.writeRow(out, Arrays.asList("Nathan", 3, null, MetricValue.undefined("empty graph")));
        assertEquals("Nathan;3;;NaN\n", out.toString());
    }

    @Test
    @DisplayName("File names keep letters and digits only")
    void testSafeFileName() {
        assertEquals("tiny_Die_kleine_Szene", CsvFormat.safeFileName("tiny_Die kleine Szene"));
        assertEquals("Kabale_und_Liebe_", CsvFormat.safeFileName("Kabale/und:Liebe?"));
        assertEquals("Müller", CsvFormat.safeFileName("Müller"));
    }
}
