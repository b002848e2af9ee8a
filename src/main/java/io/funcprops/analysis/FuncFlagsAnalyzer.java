package io.funcprops.analysis;

import io.funcprops.ir.Function;
import io.funcprops.ir.Node;
import io.funcprops.ir.NodeKind;
import io.funcprops.props.FuncPropBits;
import io.funcprops.props.FuncProps;
import io.funcprops.trace.DebugTrace;
import io.funcprops.trace.TraceCategory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Computes function-level flags, currently {@link FuncPropBits#NEVER_RETURNS}.
 * <p>
 * Each block is classified when it is left: it panics if it throws or calls a
 * method known never to return, it may return if it reaches a return and does
 * not panic. Statements directly under the function root count as one more
 * block. A function with a body never returns when none of its blocks may
 * return.
 */
public class FuncFlagsAnalyzer implements PropAnalyzer {

    /** Methods that terminate the process instead of returning. */
    static final Set<String> NON_RETURNING = Set.of(
            "java.lang.System.exit(I)V",
            "java.lang.Runtime.exit(I)V",
            "java.lang.Runtime.halt(I)V"
    );

    private enum BlockState { NO_INFO, MAY_RETURN, PANICS }

    private static final class Block {
        final int line;
        boolean panics;
        boolean returns;

        Block(int line) {
            this.line = line;
        }

        BlockState state() {
            if (panics) {
                return BlockState.PANICS;
            }
            return returns ? BlockState.MAY_RETURN : BlockState.NO_INFO;
        }
    }

    private final Function fn;
    private final DebugTrace trace;
    private final Deque<Block> open = new ArrayDeque<>();
    private boolean hasBody;
    private boolean mayReturn;

    public FuncFlagsAnalyzer(Function fn, DebugTrace trace) {
        this.fn = fn;
        this.trace = trace;
    }

    @Override
    public void nodeVisitPre(Node n) {
        switch (n.kind()) {
            case FUNC, BLOCK -> {
                if (n.is(NodeKind.FUNC) && !n.children().isEmpty()) {
                    hasBody = true;
                }
                open.push(new Block(n.line()));
            }
            case THROW -> markPanics();
            case CALL -> {
                if (NON_RETURNING.contains(n.operand())) {
                    markPanics();
                }
            }
            case RETURN -> {
                Block b = open.peek();
                if (b != null) {
                    b.returns = true;
                }
            }
            default -> {
                // not relevant to control flow
            }
        }
    }

    private void markPanics() {
        Block b = open.peek();
        if (b != null) {
            b.panics = true;
        }
    }

    @Override
    public void nodeVisitPost(Node n) {
        if (!n.is(NodeKind.FUNC) && !n.is(NodeKind.BLOCK)) {
            return;
        }
        Block b = open.poll();
        if (b == null) {
            return;
        }
        BlockState state = b.state();
        if (state == BlockState.MAY_RETURN) {
            mayReturn = true;
        }
        trace.trace(TraceCategory.FUNC_FLAGS, "%s %s at line %d: %s",
                fn.name(), n.kind(), b.line, state);
    }

    @Override
    public void setResults(FuncProps.Builder props) {
        if (hasBody && !mayReturn) {
            trace.trace(TraceCategory.FUNC_FLAGS, "%s never returns", fn.name());
            props.flag(FuncPropBits.NEVER_RETURNS);
        }
    }
}
