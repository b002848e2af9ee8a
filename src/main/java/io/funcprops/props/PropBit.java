package io.funcprops.props;

/**
 * A single property flag with the name used in human-readable dumps.
 */
public interface PropBit {

    String displayName();
}
