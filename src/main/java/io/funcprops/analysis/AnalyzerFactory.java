package io.funcprops.analysis;

import io.funcprops.ir.Function;
import io.funcprops.trace.DebugTrace;

/**
 * Creates a fresh analyzer for one function run.
 */
@FunctionalInterface
public interface AnalyzerFactory {

    PropAnalyzer create(Function fn, DebugTrace trace);
}
