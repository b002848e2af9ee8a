package io.funcprops.analysis;

import io.funcprops.ir.Node;
import io.funcprops.props.FuncProps;

/**
 * Base interface for all property analyzers.
 * <p>
 * Each analyzer computes one independent family of properties. For a given
 * function there is a sequence of {@link #nodeVisitPre} and
 * {@link #nodeVisitPost} calls as the tree is walked, then one
 * {@link #setResults} call transferring the findings into the merged
 * properties. Analyzers never modify the tree and never look at each
 * other's state; a node kind an analyzer does not care about is ignored.
 */
public interface PropAnalyzer {

    /**
     * Called before any of the node's children are visited.
     */
    void nodeVisitPre(Node n);

    /**
     * Called after all of the node's children have been visited.
     */
    void nodeVisitPost(Node n);

    /**
     * Merges this analyzer's findings into the function's properties.
     */
    void setResults(FuncProps.Builder props);
}
