package io.funcprops.dump;

import io.funcprops.props.FuncProps;

/**
 * Captured properties of one function, pending a dump.
 *
 * @param name  Function name
 * @param file  Base name of the source file
 * @param line  Declaration line
 * @param props Computed properties
 */
public record DumpEntry(
        String name,
        String file,
        int line,
        FuncProps props
) {
}
