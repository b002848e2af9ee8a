package io.funcprops.analysis;

/**
 * Answers whether the method a call or closure refers to could be inlined.
 */
@FunctionalInterface
public interface InlineEligibility {

    /**
     * @param target Key of the referenced method (see {@link io.funcprops.ir.MethodRef#key()})
     */
    boolean isInlinable(String target);

    static InlineEligibility never() {
        return target -> false;
    }
}
