package io.funcprops.props;

/**
 * Function-level properties.
 */
public enum FuncPropBits implements PropBit {
    /** Every path through the function ends in a throw or a non-returning call. */
    NEVER_RETURNS("FuncPropNeverReturns");

    private final String displayName;

    FuncPropBits(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String displayName() {
        return displayName;
    }
}
