package io.funcprops.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * One element of a function's IR tree.
 * <p>
 * Nodes are immutable; analyzers only read them. Identity matters: the same
 * node instance appears exactly once in a tree.
 *
 * @param kind       Kind tag
 * @param operand    Kind-specific operand text (constant value, slot, target key), may be null
 * @param invokeType Invocation type for {@link NodeKind#CALL} nodes, null otherwise
 * @param line       Source line, or 0 when unknown
 * @param children   Ordered child nodes
 */
public record Node(
        NodeKind kind,
        String operand,
        InvokeType invokeType,
        int line,
        List<Node> children
) {
    /**
     * Compact constructor with validation.
     */
    public Node {
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null");
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a leaf node.
     */
    public static Node leaf(NodeKind kind, String operand, int line) {
        return new Node(kind, operand, null, line, List.of());
    }

    /**
     * Creates a node with the given children and no operand.
     */
    public static Node of(NodeKind kind, Node... children) {
        return new Node(kind, null, null, 0, List.of(children));
    }

    /**
     * Returns the i-th child, or null if there is none.
     */
    public Node child(int i) {
        return i < children.size() ? children.get(i) : null;
    }

    public boolean is(NodeKind k) {
        return kind == k;
    }

    /**
     * Counts this node and all of its descendants.
     */
    public int size() {
        int n = 1;
        for (Node c : children) {
            n += c.size();
        }
        return n;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (operand != null) {
            sb.append('(').append(operand).append(')');
        }
        if (!children.isEmpty()) {
            sb.append(children);
        }
        return sb.toString();
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final NodeKind kind;
        private String operand;
        private InvokeType invokeType;
        private int line;
        private final List<Node> children = new ArrayList<>();

        private Builder(NodeKind kind) {
            this.kind = kind;
        }

        public Builder operand(String operand) {
            this.operand = operand;
            return this;
        }

        public Builder invokeType(InvokeType invokeType) {
            this.invokeType = invokeType;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder child(Node child) {
            this.children.add(child);
            return this;
        }

        public Builder children(List<Node> children) {
            this.children.addAll(children);
            return this;
        }

        public Node build() {
            return new Node(kind, operand, invokeType, line, children);
        }
    }
}
