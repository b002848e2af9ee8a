package io.funcprops.ir;

/**
 * A resolved (file, line) source position.
 */
public record SourcePosition(String file, int line) {
}
