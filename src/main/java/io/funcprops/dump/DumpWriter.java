package io.funcprops.dump;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.funcprops.props.FuncPropsCodec;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes captured entries as a deterministic function properties dump.
 * <p>
 * Entries are sorted by declaration line, then by name; ties keep the order
 * they were given in. Several functions can share a line (overloads on one
 * line, lambdas), so each block header carries the entry's index among the
 * entries at its line and the number of entries at that line.
 */
public final class DumpWriter {

    private static final Comparator<DumpEntry> ORDER =
            Comparator.comparingInt(DumpEntry::line).thenComparing(DumpEntry::name);

    private DumpWriter() {
        // Utility class
    }

    /**
     * Truncates {@code dumpFile} and writes the preamble followed by one block
     * per entry.
     *
     * @throws FatalDumpException if the file cannot be written or an entry cannot be encoded
     */
    public static void write(Path dumpFile, Collection<DumpEntry> entries) {
        try (Writer w = Files.newBufferedWriter(dumpFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            write(w, entries);
        } catch (IOException e) {
            throw new FatalDumpException("writing function props dump file " + dumpFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the dump to an open writer.
     */
    public static void write(Writer w, Collection<DumpEntry> entries) throws IOException {
        writePreamble(w);

        Map<Integer, Integer> atLine = new HashMap<>();
        for (DumpEntry e : entries) {
            atLine.merge(e.line(), 1, Integer::sum);
        }

        int prevLine = -1;
        int idx = 0;
        for (DumpEntry entry : sort(entries)) {
            idx = entry.line() == prevLine ? idx + 1 : 0;
            prevLine = entry.line();
            writeEntry(w, entry, idx, atLine.get(entry.line()));
        }
    }

    /**
     * Returns the entries in dump order.
     */
    public static List<DumpEntry> sort(Collection<DumpEntry> entries) {
        List<DumpEntry> sorted = new ArrayList<>(entries);
        sorted.sort(ORDER);
        return sorted;
    }

    private static void writePreamble(Writer w) throws IOException {
        for (String line : DumpFormat.PREAMBLE) {
            w.write(DumpFormat.COMMENT + line + "\n");
        }
        w.write(DumpFormat.COMMENT + DumpFormat.PREAMBLE_DELIMITER + "\n");
    }

    private static void writeEntry(Writer w, DumpEntry entry, int idx, int atLine) throws IOException {
        String json;
        try {
            json = FuncPropsCodec.encode(entry.props());
        } catch (JsonProcessingException e) {
            throw new FatalDumpException("encoding properties of " + entry.name() + ": " + e.getOriginalMessage(), e);
        }
        w.write(String.format("%s%s %s %d %d %d\n",
                DumpFormat.COMMENT, entry.file(), entry.name(), entry.line(), idx, atLine));
        w.write(entry.props().toString(DumpFormat.COMMENT));
        w.write(DumpFormat.COMMENT + DumpFormat.PROPS_DELIMITER + "\n");
        w.write(DumpFormat.COMMENT + json + "\n");
        w.write(DumpFormat.COMMENT + DumpFormat.FN_DELIMITER + "\n");
    }
}
