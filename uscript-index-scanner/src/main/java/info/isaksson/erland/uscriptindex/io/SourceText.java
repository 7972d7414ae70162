package info.isaksson.erland.uscriptindex.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** Reading and line splitting for UnrealScript source text. */
public final class SourceText {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private SourceText() {}

    /**
     * Split on CRLF, CR or LF. A trailing line break yields a final empty line, so line numbers
     * match what an editor shows.
     */
    public static List<String> lines(String text) {
        if (text == null || text.isEmpty()) return List.of();
        return Arrays.asList(LINE_BREAK.split(text, -1));
    }

    /**
     * Read a file as UTF-8. Malformed byte sequences are replaced rather than rejected, so legacy
     * Latin-1 sources still index. A leading byte order mark is dropped; {@code \s} does not match
     * it, so a class declared on the first line would otherwise go unnoticed.
     */
    public static String read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            return text.substring(1);
        }
        return text;
    }
}
