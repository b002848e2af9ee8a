package io.funcprops.props;

/**
 * Per-parameter properties.
 */
public enum ParamPropBits implements PropBit {
    /** The parameter is the receiver of an interface method call on some path. */
    MAY_FEED_INTERFACE_METHOD_CALL("ParamMayFeedInterfaceMethodCall"),
    /** The parameter is compared by a conditional branch or switch on some path. */
    MAY_FEED_IF_OR_SWITCH("ParamMayFeedIfOrSwitch");

    private final String displayName;

    ParamPropBits(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String displayName() {
        return displayName;
    }
}
