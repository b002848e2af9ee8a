package io.funcprops.dump;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.funcprops.props.FuncProps;
import io.funcprops.props.FuncPropsCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses a function properties dump back into its entries.
 */
public final class DumpReader {

    /**
     * One function block of a dump.
     *
     * @param file     Source file base name
     * @param name     Function name
     * @param line     Declaration line
     * @param index    Index among the entries at this line
     * @param count    Number of entries at this line
     * @param rendered Human-readable rendering, comment markers removed
     * @param props    Properties decoded from the JSON line
     */
    public record Entry(
            String file,
            String name,
            int line,
            int index,
            int count,
            String rendered,
            FuncProps props
    ) {}

    private DumpReader() {
        // Utility class
    }

    public static List<Entry> read(Path dumpFile) throws IOException {
        return parse(Files.readAllLines(dumpFile, StandardCharsets.UTF_8));
    }

    public static List<Entry> parse(String content) {
        return parse(content.lines().toList());
    }

    /**
     * Parses dump lines.
     *
     * @throws IllegalStateException if the text is not a well-formed dump
     */
    public static List<Entry> parse(List<String> lines) {
        int pos = 0;
        String preambleEnd = DumpFormat.COMMENT + DumpFormat.PREAMBLE_DELIMITER;
        while (pos < lines.size() && !lines.get(pos).equals(preambleEnd)) {
            pos++;
        }
        if (pos == lines.size()) {
            throw new IllegalStateException("missing " + DumpFormat.PREAMBLE_DELIMITER + " delimiter");
        }
        pos++;

        List<Entry> entries = new ArrayList<>();
        while (pos < lines.size()) {
            if (lines.get(pos).isBlank()) {
                pos++;
                continue;
            }
            int headerLine = pos + 1;
            String[] header = stripComment(lines.get(pos), headerLine).split(" ");
            if (header.length < 5) {
                throw malformed(headerLine, "function header needs 5 fields: " + lines.get(pos));
            }
            int n = header.length;
            String file = String.join(" ", Arrays.copyOfRange(header, 0, n - 4));
            String name = header[n - 4];
            int line = parseInt(header[n - 3], headerLine);
            int index = parseInt(header[n - 2], headerLine);
            int count = parseInt(header[n - 1], headerLine);
            pos++;

            StringBuilder rendered = new StringBuilder();
            String propsEnd = DumpFormat.COMMENT + DumpFormat.PROPS_DELIMITER;
            while (pos < lines.size() && !lines.get(pos).equals(propsEnd)) {
                rendered.append(stripComment(lines.get(pos), pos + 1)).append('\n');
                pos++;
            }
            if (pos >= lines.size()) {
                throw malformed(headerLine, "missing " + DumpFormat.PROPS_DELIMITER + " for " + name);
            }
            pos++;

            if (pos >= lines.size()) {
                throw malformed(pos, "missing JSON line for " + name);
            }
            FuncProps props = decode(stripComment(lines.get(pos), pos + 1), pos + 1);
            pos++;

            if (pos >= lines.size() || !lines.get(pos).equals(DumpFormat.COMMENT + DumpFormat.FN_DELIMITER)) {
                throw malformed(pos + 1, "missing " + DumpFormat.FN_DELIMITER + " for " + name);
            }
            pos++;

            entries.add(new Entry(file, name, line, index, count, rendered.toString(), props));
        }
        return entries;
    }

    private static String stripComment(String text, int lineNo) {
        if (!text.startsWith(DumpFormat.COMMENT)) {
            throw malformed(lineNo, "expected comment line: " + text);
        }
        return text.substring(DumpFormat.COMMENT.length());
    }

    private static int parseInt(String s, int lineNo) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("dump line " + lineNo + ": not a number: " + s, e);
        }
    }

    private static FuncProps decode(String json, int lineNo) {
        try {
            return FuncPropsCodec.decode(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("dump line " + lineNo + ": bad properties JSON: "
                    + e.getOriginalMessage(), e);
        }
    }

    private static IllegalStateException malformed(int lineNo, String msg) {
        return new IllegalStateException("dump line " + lineNo + ": " + msg);
    }
}
