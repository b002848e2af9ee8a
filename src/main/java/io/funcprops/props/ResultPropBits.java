package io.funcprops.props;

/**
 * Per-result properties.
 */
public enum ResultPropBits implements PropBit {
    /** Every return hands back a freshly allocated object or array. */
    IS_ALLOCATED_MEM("ResultIsAllocatedMem"),
    /** Every return hands back the same constant. */
    ALWAYS_SAME_CONSTANT("ResultAlwaysSameConstant"),
    /** Every return hands back a closure over the same method. */
    ALWAYS_SAME_FUNC("ResultAlwaysSameFunc"),
    /** As {@link #ALWAYS_SAME_FUNC}, and that method is inlinable. */
    ALWAYS_SAME_INLINABLE_FUNC("ResultAlwaysSameInlinableFunc");

    private final String displayName;

    ResultPropBits(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String displayName() {
        return displayName;
    }
}
