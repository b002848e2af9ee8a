package io.funcprops.analysis;

import io.funcprops.ir.Function;
import io.funcprops.trace.DebugTrace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered registry of analyzer families.
 * The order is the visit order and the merge order.
 */
public class AnalyzerRegistry {

    private final List<AnalyzerFactory> factories;

    private AnalyzerRegistry(List<AnalyzerFactory> factories) {
        this.factories = List.copyOf(factories);
    }

    /**
     * Creates a registry with all default analyzers: function flags,
     * parameters, results.
     */
    public static AnalyzerRegistry createDefault(InlineEligibility canInline) {
        return new AnalyzerRegistry(List.of(
                FuncFlagsAnalyzer::new,
                (fn, trace) -> new ParamsAnalyzer(fn),
                (fn, trace) -> new ResultsAnalyzer(fn, canInline, trace)
        ));
    }

    /**
     * Creates a registry with specific analyzers.
     */
    public static AnalyzerRegistry of(AnalyzerFactory... factories) {
        return new AnalyzerRegistry(Arrays.asList(factories));
    }

    /**
     * Creates one fresh analyzer per family for the given function.
     */
    public List<PropAnalyzer> instantiate(Function fn, DebugTrace trace) {
        List<PropAnalyzer> analyzers = new ArrayList<>(factories.size());
        for (AnalyzerFactory f : factories) {
            analyzers.add(f.create(fn, trace));
        }
        return analyzers;
    }

    public int size() {
        return factories.size();
    }
}
