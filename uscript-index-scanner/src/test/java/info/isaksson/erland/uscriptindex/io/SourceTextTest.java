package info.isaksson.erland.uscriptindex.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceTextTest {

    @Test
    void splitsOnEveryLineEndingConvention() {
        assertEquals(List.of("a", "b", "c", "d"), SourceText.lines("a\r\nb\nc\rd"));
    }

    @Test
    void trailingBreakProducesFinalEmptyLine() {
        assertEquals(List.of("class A;", ""), SourceText.lines("class A;\n"));
        assertEquals(List.of(), SourceText.lines(""));
        assertEquals(List.of(), SourceText.lines(null));
    }

    @Test
    void readReplacesMalformedUtf8(@TempDir Path tmp) throws Exception {
        Path f = tmp.resolve("Latin.uc");
        Files.write(f, new byte[] {'v', 'a', 'r', ' ', 'i', 'n', 't', ' ', 'X', (byte) 0xE9, ';'});

        String text = SourceText.read(f);

        assertTrue(text.startsWith("var int X"));
        assertTrue(text.contains("�"));
    }

    @Test
    void readDropsLeadingByteOrderMark(@TempDir Path tmp) throws Exception {
        Path f = tmp.resolve("Actor.uc");
        Files.write(f, new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'c', 'l', 'a', 's', 's', ' ', 'A', ';'});

        assertEquals("class A;", SourceText.read(f));
    }
}
