package io.funcprops.bytecode;

import io.funcprops.analysis.InlineEligibility;
import io.funcprops.ir.Function;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Treats a method as inlinable when it was scanned and its tree is no larger
 * than a node budget.
 */
public class NodeBudgetEligibility implements InlineEligibility {

    private final Map<String, Integer> sizes = new HashMap<>();
    private final int budget;

    public NodeBudgetEligibility(List<Function> functions, int budget) {
        this.budget = budget;
        for (Function fn : functions) {
            if (fn.ref() != null) {
                sizes.put(fn.ref().key(), fn.root().size());
            }
        }
    }

    @Override
    public boolean isInlinable(String target) {
        Integer size = sizes.get(target);
        return size != null && size <= budget;
    }
}
