package io.funcprops.analysis;

import io.funcprops.ir.Node;
import io.funcprops.props.FuncProps;

import java.util.List;

/**
 * Runs a list of analyzers over a function's tree in a single walk.
 */
public final class AnalyzerRunner {

    private AnalyzerRunner() {
        // Utility class
    }

    /**
     * Walks the tree depth-first. Every analyzer sees the pre-visit of a node,
     * in list order, before any child is walked, and its post-visit after the
     * last child.
     */
    public static void runAnalyzersOnFunction(Node root, List<? extends PropAnalyzer> analyzers) {
        visit(root, analyzers);
    }

    private static void visit(Node n, List<? extends PropAnalyzer> analyzers) {
        for (PropAnalyzer a : analyzers) {
            a.nodeVisitPre(n);
        }
        for (Node child : n.children()) {
            visit(child, analyzers);
        }
        for (PropAnalyzer a : analyzers) {
            a.nodeVisitPost(n);
        }
    }

    /**
     * Walks the tree, then merges every analyzer's findings in list order.
     */
    public static FuncProps.Builder run(Node root, List<? extends PropAnalyzer> analyzers) {
        runAnalyzersOnFunction(root, analyzers);
        FuncProps.Builder props = FuncProps.builder();
        for (PropAnalyzer a : analyzers) {
            a.setResults(props);
        }
        return props;
    }
}
