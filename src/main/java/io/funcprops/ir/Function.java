package io.funcprops.ir;

import java.util.List;

/**
 * A named, located unit of code with exactly one root node.
 * <p>
 * Identity is the object reference: two functions may share a name and a
 * declaration line (overloads, lambdas on one line), so {@code equals} is not
 * overridden.
 */
public final class Function {

    private final String name;
    private final String file;
    private final int line;
    private final Node root;
    private final MethodRef ref;
    private final List<Integer> paramSlots;
    private final int resultCount;

    private Function(Builder b) {
        if (b.name == null || b.name.isBlank()) {
            throw new IllegalArgumentException("Function name cannot be null or blank");
        }
        if (b.root == null) {
            throw new IllegalArgumentException("Function " + b.name + " has no root node");
        }
        this.name = b.name;
        this.file = b.file;
        this.line = b.line;
        this.root = b.root;
        this.ref = b.ref;
        this.paramSlots = List.copyOf(b.paramSlots);
        this.resultCount = b.resultCount;
    }

    public String name() {
        return name;
    }

    public String file() {
        return file;
    }

    /**
     * Declaration line, or 0 when unknown.
     */
    public int line() {
        return line;
    }

    public Node root() {
        return root;
    }

    /**
     * Reference used by call and closure nodes to name this function, may be null.
     */
    public MethodRef ref() {
        return ref;
    }

    /**
     * Local variable slots of the declared parameters, in declaration order.
     */
    public List<Integer> paramSlots() {
        return paramSlots;
    }

    public int paramCount() {
        return paramSlots.size();
    }

    /**
     * Number of results: 0 for void, 1 otherwise.
     */
    public int resultCount() {
        return resultCount;
    }

    @Override
    public String toString() {
        return name + " (" + file + ":" + line + ")";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String file;
        private int line;
        private Node root;
        private MethodRef ref;
        private List<Integer> paramSlots = List.of();
        private int resultCount;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder root(Node root) {
            this.root = root;
            return this;
        }

        public Builder ref(MethodRef ref) {
            this.ref = ref;
            return this;
        }

        public Builder paramSlots(List<Integer> paramSlots) {
            this.paramSlots = paramSlots;
            return this;
        }

        public Builder resultCount(int resultCount) {
            this.resultCount = resultCount;
            return this;
        }

        public Function build() {
            return new Function(this);
        }
    }
}
