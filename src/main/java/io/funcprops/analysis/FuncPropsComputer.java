package io.funcprops.analysis;

import io.funcprops.ir.Function;
import io.funcprops.props.FuncProps;
import io.funcprops.trace.DebugTrace;
import io.funcprops.trace.TraceCategory;

import java.io.PrintStream;
import java.util.List;
import java.util.Set;

/**
 * Computes the properties of a single function by running every registered
 * analyzer over it in one walk.
 * <p>
 * Analyzers and the trace scope are created fresh for each call, so one
 * computer can be reused across functions and shared between threads.
 */
public class FuncPropsComputer {

    private final AnalyzerRegistry registry;
    private final Set<TraceCategory> traceCategories;
    private final PrintStream traceOut;

    public FuncPropsComputer(AnalyzerRegistry registry) {
        this(registry, Set.of(), System.err);
    }

    public FuncPropsComputer(AnalyzerRegistry registry, Set<TraceCategory> traceCategories, PrintStream traceOut) {
        this.registry = registry;
        this.traceCategories = Set.copyOf(traceCategories);
        this.traceOut = traceOut;
    }

    /**
     * Creates a computer with the default analyzers.
     */
    public static FuncPropsComputer createDefault(InlineEligibility canInline, Set<TraceCategory> traceCategories) {
        return new FuncPropsComputer(AnalyzerRegistry.createDefault(canInline), traceCategories, System.err);
    }

    public FuncProps compute(Function fn) {
        try (DebugTrace trace = DebugTrace.open(traceCategories, traceOut)) {
            trace.trace(TraceCategory.FUNCS, "starting analysis of func %s:%n%s", fn.name(), fn.root());

            List<PropAnalyzer> analyzers = registry.instantiate(fn, trace);
            FuncProps props = AnalyzerRunner.run(fn.root(), analyzers).build();

            if (trace.enabled(TraceCategory.RESULTS)) {
                String rendered = props.toString("  ");
                trace.trace(TraceCategory.RESULTS, "results for func %s:%n%s",
                        fn.name(), rendered.isEmpty() ? "  <none>" : rendered.stripTrailing());
            }
            return props;
        }
    }
}
