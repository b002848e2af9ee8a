package io.funcprops.trace;

import java.util.Locale;

/**
 * Independently toggleable diagnostic trace categories.
 */
public enum TraceCategory {
    /** Function entry, with the function's tree. */
    FUNCS(1),
    /** Function flag computation. */
    FUNC_FLAGS(1 << 1),
    /** Computed results per function. */
    RESULTS(1 << 2);

    private final int bit;

    TraceCategory(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    /**
     * Looks up a category by name, ignoring case and accepting '-' for '_'.
     *
     * @throws IllegalArgumentException if no category has that name
     */
    public static TraceCategory fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (TraceCategory c : values()) {
            if (c.name().equals(normalized)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown trace category: " + name);
    }
}
