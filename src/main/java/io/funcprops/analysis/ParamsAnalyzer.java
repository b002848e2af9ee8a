package io.funcprops.analysis;

import io.funcprops.ir.Function;
import io.funcprops.ir.InvokeType;
import io.funcprops.ir.Node;
import io.funcprops.ir.NodeKind;
import io.funcprops.props.FuncProps;
import io.funcprops.props.ParamPropBits;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes per-parameter flags.
 * <p>
 * A parameter is only followed while it still holds its incoming value: once
 * its slot has been stored to, later loads of that slot no longer count.
 */
public class ParamsAnalyzer implements PropAnalyzer {

    private final Map<Integer, Integer> slotToParam = new HashMap<>();
    private final List<EnumSet<ParamPropBits>> flags = new ArrayList<>();
    private final boolean[] reassigned;

    public ParamsAnalyzer(Function fn) {
        List<Integer> slots = fn.paramSlots();
        for (int i = 0; i < slots.size(); i++) {
            slotToParam.put(slots.get(i), i);
            flags.add(EnumSet.noneOf(ParamPropBits.class));
        }
        this.reassigned = new boolean[slots.size()];
    }

    @Override
    public void nodeVisitPre(Node n) {
        if (slotToParam.isEmpty()) {
            return;
        }
        switch (n.kind()) {
            case CALL -> {
                if (n.invokeType() == InvokeType.INTERFACE) {
                    mark(n.child(0), ParamPropBits.MAY_FEED_INTERFACE_METHOD_CALL);
                }
            }
            case BRANCH, SWITCH -> {
                for (Node operand : n.children()) {
                    mark(operand, ParamPropBits.MAY_FEED_IF_OR_SWITCH);
                }
            }
            default -> {
                // no parameter use of interest
            }
        }
    }

    @Override
    public void nodeVisitPost(Node n) {
        // The stored value is visited before the slot counts as reassigned.
        if (n.is(NodeKind.STORE)) {
            int param = paramIndex(n);
            if (param >= 0) {
                reassigned[param] = true;
            }
        }
    }

    private void mark(Node operand, ParamPropBits bit) {
        if (operand == null || !operand.is(NodeKind.LOAD)) {
            return;
        }
        int param = paramIndex(operand);
        if (param >= 0 && !reassigned[param]) {
            flags.get(param).add(bit);
        }
    }

    /**
     * Returns the parameter index of a local variable load or store, or -1.
     */
    private int paramIndex(Node n) {
        String operand = n.operand();
        if (operand == null || operand.isEmpty() || operand.length() > 5
                || !operand.chars().allMatch(Character::isDigit)) {
            return -1;
        }
        Integer param = slotToParam.get(Integer.parseInt(operand));
        return param != null ? param : -1;
    }

    @Override
    public void setResults(FuncProps.Builder props) {
        props.paramFlags(new ArrayList<Set<ParamPropBits>>(flags));
    }
}
