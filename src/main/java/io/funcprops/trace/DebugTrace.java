package io.funcprops.trace;

import java.io.PrintStream;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Diagnostic trace scope for one function analysis.
 * <p>
 * Opened at the start of an analysis and closed at its end; closing clears
 * every category so nothing carries over to the next function. Tracing only
 * writes text to its stream and never influences computed properties.
 */
public final class DebugTrace implements AutoCloseable {

    /** Environment variable holding a decimal bitmask or a comma-separated category list. */
    public static final String ENV_VAR = "FUNCPROPS_DEBUG_TRACE";

    private static final String PREFIX = "=-= ";

    private final EnumSet<TraceCategory> enabled;
    private final PrintStream out;

    private DebugTrace(Set<TraceCategory> categories, PrintStream out) {
        this.enabled = EnumSet.noneOf(TraceCategory.class);
        this.enabled.addAll(categories);
        this.out = out;
    }

    public static DebugTrace open(Set<TraceCategory> categories, PrintStream out) {
        return new DebugTrace(categories, out);
    }

    public static DebugTrace disabled() {
        return new DebugTrace(Set.of(), System.err);
    }

    public boolean enabled(TraceCategory category) {
        return enabled.contains(category);
    }

    public boolean anyEnabled() {
        return !enabled.isEmpty();
    }

    /**
     * Writes one formatted trace line if the category is enabled.
     */
    public void trace(TraceCategory category, String format, Object... args) {
        if (enabled.contains(category)) {
            out.println(PREFIX + String.format(format, args));
        }
    }

    @Override
    public void close() {
        enabled.clear();
        out.flush();
    }

    /**
     * Parses a trace setting: either a decimal bitmask of {@link TraceCategory#bit()}
     * values or a comma-separated list of category names. Blank means none.
     *
     * @throws IllegalArgumentException on an unknown name or a malformed number
     */
    public static Set<TraceCategory> parse(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        String trimmed = value.trim();
        EnumSet<TraceCategory> result = EnumSet.noneOf(TraceCategory.class);
        if (Character.isDigit(trimmed.charAt(0))) {
            int mask = Integer.parseInt(trimmed);
            for (TraceCategory c : TraceCategory.values()) {
                if ((mask & c.bit()) != 0) {
                    result.add(c);
                }
            }
            return Collections.unmodifiableSet(result);
        }
        for (String part : trimmed.split(",")) {
            if (!part.isBlank()) {
                result.add(TraceCategory.fromName(part));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Reads {@link #ENV_VAR}. A malformed value is reported and ignored.
     */
    public static Set<TraceCategory> fromEnvironment() {
        String value = System.getenv(ENV_VAR);
        try {
            return parse(value);
        } catch (IllegalArgumentException e) {
            System.err.println("Warning: Ignoring " + ENV_VAR + "=" + value + ": " + e.getMessage());
            return Set.of();
        }
    }
}
