package io.funcprops.dump;

import io.funcprops.ir.Function;

import java.nio.file.Path;

/**
 * Entry point for dumping function properties in unit-test mode.
 */
public class FuncPropsDumper {

    private final DumpBuffer buffer;
    private final Path configuredDumpFile;

    /**
     * @param buffer             Buffer to capture into
     * @param configuredDumpFile Dump file requested by configuration, or null when not dumping
     */
    public FuncPropsDumper(DumpBuffer buffer, Path configuredDumpFile) {
        this.buffer = buffer;
        this.configuredDumpFile = configuredDumpFile;
    }

    /**
     * Returns true if a properties dump was requested.
     */
    public boolean unitTesting() {
        return configuredDumpFile != null;
    }

    /**
     * Captures the properties of {@code fn}, or if {@code fn} is null, writes
     * every captured entry to {@code dumpFile}.
     *
     * @throws FatalDumpException if flushing fails
     */
    public void dumpFuncProps(Function fn, Path dumpFile) {
        if (fn != null) {
            buffer.capture(fn);
        } else {
            buffer.flush(dumpFile);
        }
    }

    /**
     * Flushes to the configured dump file.
     */
    public void flush() {
        if (configuredDumpFile == null) {
            throw new IllegalStateException("No dump file configured");
        }
        buffer.flush(configuredDumpFile);
    }

    public DumpBuffer buffer() {
        return buffer;
    }
}
