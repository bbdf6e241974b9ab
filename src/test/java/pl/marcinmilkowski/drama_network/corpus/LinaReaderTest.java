package pl.marcinmilkowski.drama_network.corpus;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.drama_network.TestPlays;
import pl.marcinmilkowski.drama_network.model.PlayMetadata;
import pl.marcinmilkowski.drama_network.model.PlayRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LinaReader against a small LINA file.
 */
class LinaReaderTest {

    private final LinaReader reader = new LinaReader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Read metadata, characters and segments")
    void testReadFixture() throws IOException {
        PlayRecord play = reader.read(TestPlays.TINY_PLAY_XML);

        assertEquals("tiny", play.id());
        assertEquals(List.of("Alpha", "Beta", "Gamma", "Delta"), play.universe());
        assertEquals(3, play.segmentCount());
        assertEquals(Set.of("Alpha", "Beta"), play.segments().get(0));
        assertEquals(Set.of("Beta", "Gamma"), play.segments().get(1));
        assertEquals(Set.of("Alpha", "Gamma"), play.segments().get(2), "aliases resolve to one name");

        PlayMetadata metadata = play.metadata();
        assertEquals("Die kleine Szene", metadata.title());
        assertEquals("Ein Lustspiel", metadata.subtitle());
        assertEquals("Anonymus", metadata.author());
        assertEquals(1780, metadata.datePrint());
        assertEquals(1770, metadata.dateWritten());
        assertEquals(1783, metadata.datePremiere());
        assertEquals(1780, metadata.dateDefinite());
        assertEquals("tiny_play", metadata.filename());
        assertEquals(3, metadata.segmentCount());
        assertEquals("scenes", metadata.countType());
    }

    @Test
    @DisplayName("Unknown speaker aliases are format errors")
    void testUnknownAlias() throws IOException {
        Path file = write("unknown.xml", play("<sp who=\"#a #zz\"/>"));
        CorpusFormatException e = assertThrows(CorpusFormatException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("zz"));
    }

    @Test
    @DisplayName("Root without id is a format error")
    void testMissingId() throws IOException {
        Path file = write("noid.xml", play("<sp who=\"#a\"/>").replace(" id=\"p\"", ""));
        assertThrows(CorpusFormatException.class, () -> reader.read(file));
    }

    @Test
    @DisplayName("Malformed XML is a format error")
    void testMalformed() throws IOException {
        Path file = write("broken.xml", "<lina id=\"x\"><header>");
        assertThrows(CorpusFormatException.class, () -> reader.read(file));
    }

    @Test
    @DisplayName("Headings that are not scenes count as acts")
    void testActs() throws IOException {
        Path file = write("acts.xml", play("<sp who=\"#a\"/>"));
        PlayRecord play = reader.read(file);

        assertEquals("acts", play.metadata().countType());
        assertNull(play.metadata().dateDefinite());
        assertEquals(List.of("A"), play.universe());
    }

    @Test
    @DisplayName("File base name drops the extension")
    void testBaseName() {
        assertEquals("tiny_play", LinaReader.baseName(Path.of("dir", "tiny_play.xml")));
        assertEquals("noext", LinaReader.baseName(Path.of("noext")));
    }

    private static String play(String speeches) {
        return "<lina id=\"p\"><header><title>T</title></header>"
            + "<personae><character><name>A</name><alias xml:id=\"a\"/></character></personae>"
            + "<text><div><head>Erster Aufzug</head>" + speeches + "</div></text></lina>";
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
