package io.funcprops.analysis;

import io.funcprops.ir.Function;
import io.funcprops.ir.Node;
import io.funcprops.ir.NodeKind;
import io.funcprops.props.FuncProps;
import io.funcprops.props.ResultPropBits;
import io.funcprops.trace.DebugTrace;
import io.funcprops.trace.TraceCategory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Computes per-result flags by looking at the value every return hands back.
 * The i-th child of a {@link NodeKind#RETURN} node is the value of result i.
 * A {@link NodeKind#MERGE} counts as each of its alternatives being returned.
 */
public class ResultsAnalyzer implements PropAnalyzer {

    private static final class ResultState {
        final EnumSet<ResultPropBits> candidates = EnumSet.allOf(ResultPropBits.class);
        boolean seen;
        String constant;
        String func;
    }

    private final Function fn;
    private final InlineEligibility canInline;
    private final DebugTrace trace;
    private final List<ResultState> results = new ArrayList<>();

    public ResultsAnalyzer(Function fn, InlineEligibility canInline, DebugTrace trace) {
        this.fn = fn;
        this.canInline = canInline;
        this.trace = trace;
        for (int i = 0; i < fn.resultCount(); i++) {
            results.add(new ResultState());
        }
    }

    @Override
    public void nodeVisitPre(Node n) {
        if (!n.is(NodeKind.RETURN)) {
            return;
        }
        int count = Math.min(results.size(), n.children().size());
        for (int i = 0; i < count; i++) {
            examineAll(results.get(i), n.child(i));
        }
    }

    @Override
    public void nodeVisitPost(Node n) {
        // all work happens on the way down
    }

    /**
     * Looks through casts to the value being converted.
     */
    private static Node unwrap(Node value) {
        Node v = value;
        while (v.is(NodeKind.CONVERT) && v.children().size() == 1) {
            v = v.child(0);
        }
        return v;
    }

    private void examineAll(ResultState r, Node value) {
        Node v = unwrap(value);
        if (v.is(NodeKind.MERGE)) {
            for (Node alternative : v.children()) {
                examineAll(r, alternative);
            }
        } else {
            examine(r, v);
        }
    }

    private void examine(ResultState r, Node value) {
        r.seen = true;
        if (!value.is(NodeKind.NEW)) {
            r.candidates.remove(ResultPropBits.IS_ALLOCATED_MEM);
        }
        if (value.is(NodeKind.CONST)) {
            if (r.constant == null) {
                r.constant = String.valueOf(value.operand());
            } else if (!r.constant.equals(String.valueOf(value.operand()))) {
                r.candidates.remove(ResultPropBits.ALWAYS_SAME_CONSTANT);
            }
        } else {
            r.candidates.remove(ResultPropBits.ALWAYS_SAME_CONSTANT);
        }
        if (value.is(NodeKind.CLOSURE) && value.operand() != null) {
            if (r.func == null) {
                r.func = value.operand();
            } else if (!Objects.equals(r.func, value.operand())) {
                r.candidates.remove(ResultPropBits.ALWAYS_SAME_FUNC);
            }
        } else {
            r.candidates.remove(ResultPropBits.ALWAYS_SAME_FUNC);
        }
        trace.trace(TraceCategory.RESULTS, "%s return at line %d: %s -> %s",
                fn.name(), value.line(), value.kind(), r.candidates);
    }

    @Override
    public void setResults(FuncProps.Builder props) {
        List<Set<ResultPropBits>> flags = new ArrayList<>(results.size());
        for (ResultState r : results) {
            if (!r.seen) {
                flags.add(EnumSet.noneOf(ResultPropBits.class));
                continue;
            }
            EnumSet<ResultPropBits> bits = EnumSet.copyOf(r.candidates);
            if (!bits.contains(ResultPropBits.ALWAYS_SAME_FUNC) || !canInline.isInlinable(r.func)) {
                bits.remove(ResultPropBits.ALWAYS_SAME_INLINABLE_FUNC);
            }
            flags.add(bits);
        }
        props.resultFlags(flags);
    }
}
