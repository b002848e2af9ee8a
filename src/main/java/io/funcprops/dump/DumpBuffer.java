package io.funcprops.dump;

import io.funcprops.analysis.FuncPropsComputer;
import io.funcprops.ir.Function;
import io.funcprops.ir.PositionResolver;
import io.funcprops.ir.SourcePosition;
import io.funcprops.props.FuncProps;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects function properties while a dump is requested, until they are
 * flushed to a dump file.
 * <p>
 * Lifecycle: uninitialized, then populated by {@link #capture} calls, then
 * emptied by {@link #flush}. Functions are keyed by identity. Mutations are
 * serialized, so several threads may capture into one buffer. Properties are
 * computed outside the lock.
 */
public class DumpBuffer {

    /** Name prefixes of compiler-synthesized functions that are never captured. */
    public static final List<String> DEFAULT_RESERVED_PREFIXES = List.of(".eq.", ".bridge.");

    private final FuncPropsComputer computer;
    private final PositionResolver positions;
    private final List<String> reservedPrefixes;

    private Map<Function, DumpEntry> entries;
    private List<DumpEntry> captureOrder;

    public DumpBuffer(FuncPropsComputer computer) {
        this(computer, PositionResolver.basename(), DEFAULT_RESERVED_PREFIXES);
    }

    public DumpBuffer(FuncPropsComputer computer, PositionResolver positions, List<String> reservedPrefixes) {
        this.computer = computer;
        this.positions = positions;
        this.reservedPrefixes = List.copyOf(reservedPrefixes);
    }

    /**
     * Computes and records the properties of {@code fn}. Functions with a
     * reserved name and functions already captured are skipped.
     *
     * @return true if a new entry was added
     */
    public boolean capture(Function fn) {
        if (isReserved(fn.name())) {
            return false;
        }
        synchronized (this) {
            initialize();
            // Closures can be reached more than once; keep the first.
            if (entries.containsKey(fn)) {
                return false;
            }
        }

        FuncProps props = computer.compute(fn);
        SourcePosition pos = positions.resolve(fn);
        DumpEntry entry = new DumpEntry(fn.name(), pos.file(), pos.line(), props);

        synchronized (this) {
            // A flush may have emptied the buffer while the entry was computed
            initialize();
            if (entries.putIfAbsent(fn, entry) != null) {
                return false;
            }
            captureOrder.add(entry);
            return true;
        }
    }

    private void initialize() {
        if (entries == null) {
            entries = new IdentityHashMap<>();
            captureOrder = new ArrayList<>();
        }
    }

    private boolean isReserved(String name) {
        for (String prefix : reservedPrefixes) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public synchronized boolean contains(Function fn) {
        return entries != null && entries.containsKey(fn);
    }

    public synchronized boolean isInitialized() {
        return entries != null;
    }

    public synchronized int size() {
        return entries == null ? 0 : entries.size();
    }

    /**
     * Returns the captured entries in capture order.
     */
    public synchronized List<DumpEntry> entries() {
        return captureOrder == null ? List.of() : List.copyOf(captureOrder);
    }

    /**
     * Writes every captured entry to {@code dumpFile} and empties the buffer.
     * An uninitialized buffer still produces a file holding the preamble.
     *
     * @throws FatalDumpException if the dump cannot be written
     */
    public synchronized void flush(Path dumpFile) {
        try {
            DumpWriter.write(dumpFile, entries());
        } finally {
            entries = null;
            captureOrder = null;
        }
    }
}
