package io.funcprops.ir;

import java.nio.file.Path;

/**
 * Resolves the innermost source position of a function's declaration.
 */
@FunctionalInterface
public interface PositionResolver {

    SourcePosition resolve(Function fn);

    /**
     * Resolver that reduces the file to its base name, as dumps record it.
     */
    static PositionResolver basename() {
        return fn -> {
            String file = fn.file();
            if (file == null || file.isEmpty()) {
                return new SourcePosition("?", fn.line());
            }
            Path name = Path.of(file).getFileName();
            return new SourcePosition(name != null ? name.toString() : file, fn.line());
        };
    }
}
