package io.funcprops.bytecode;

import io.funcprops.ir.InvokeType;
import io.funcprops.ir.MethodRef;
import io.funcprops.ir.Node;
import io.funcprops.ir.NodeKind;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MethodVisitor that folds a method body into a node tree.
 * Performs lightweight stack simulation so that every instruction consuming
 * values gets the nodes that produced them as children.
 * <p>
 * The resulting tree is a {@link NodeKind#FUNC} root whose children are
 * {@link NodeKind#BLOCK}s of statements. An instruction whose result is not
 * consumed (void calls, stores, returns, jumps) is a statement. Jumps,
 * switches, returns and throws end a block; labels that are known jump or
 * handler targets start a new one. Values on the stack at a forward jump are
 * carried to its target; where several paths meet with different values the
 * target sees a {@link NodeKind#MERGE} of them. Values still on the stack when
 * the method ends are kept as trailing statements so that no instruction is lost.
 */
public class FunctionTreeBuilder extends MethodVisitor {

    private static final String LAMBDA_METAFACTORY = "java/lang/invoke/LambdaMetafactory";

    private final String methodName;

    // Simulated operand stack; the top is the last element
    private final List<Node> stack = new ArrayList<>();

    // NEW instructions awaiting their constructor call
    private final Set<Node> pendingNews = Collections.newSetFromMap(new IdentityHashMap<>());

    private final Set<Label> targets = new HashSet<>();
    private final Set<Label> handlers = new HashSet<>();
    private final Set<Label> visited = new HashSet<>();

    // Stacks carried by forward jumps, keyed by target
    private final Map<Label, List<List<Node>>> carried = new HashMap<>();

    // False after a return, throw, goto or switch until the next label
    private boolean reachable = true;

    private final List<Node> blocks = new ArrayList<>();
    private List<Node> current = new ArrayList<>();

    private int line;
    private int firstLine;
    private Node root;

    public FunctionTreeBuilder(String methodName) {
        super(Opcodes.ASM9);
        this.methodName = methodName;
    }

    @Override
    public void visitInsn(int opcode) {
        if (opcode == Opcodes.NOP) {
            return;
        }
        if (opcode == Opcodes.ACONST_NULL) {
            push(Node.leaf(NodeKind.CONST, "null", line));
        } else if (opcode >= Opcodes.ICONST_M1 && opcode <= Opcodes.ICONST_5) {
            push(Node.leaf(NodeKind.CONST, String.valueOf(opcode - Opcodes.ICONST_0), line));
        } else if (opcode == Opcodes.LCONST_0 || opcode == Opcodes.LCONST_1) {
            push(Node.leaf(NodeKind.CONST, (opcode - Opcodes.LCONST_0) + "L", line));
        } else if (opcode >= Opcodes.FCONST_0 && opcode <= Opcodes.FCONST_2) {
            push(Node.leaf(NodeKind.CONST, (opcode - Opcodes.FCONST_0) + ".0f", line));
        } else if (opcode == Opcodes.DCONST_0 || opcode == Opcodes.DCONST_1) {
            push(Node.leaf(NodeKind.CONST, (opcode - Opcodes.DCONST_0) + ".0", line));
        } else if (opcode >= Opcodes.IALOAD && opcode <= Opcodes.SALOAD) {
            expr(NodeKind.INDEX, null, 2);
        } else if (opcode >= Opcodes.IASTORE && opcode <= Opcodes.SASTORE) {
            stmt(NodeKind.STORE, null, 3);
        } else if (opcode == Opcodes.POP || opcode == Opcodes.POP2) {
            // The discarded value is still evaluated, so keep it as a statement
            Node discarded = pop();
            if (discarded != null) {
                emit(discarded);
            }
        } else if (opcode >= Opcodes.DUP && opcode <= Opcodes.DUP2_X2) {
            dup();
        } else if (opcode == Opcodes.SWAP) {
            Node a = pop();
            Node b = pop();
            if (a != null) push(a);
            if (b != null) push(b);
        } else if (opcode >= Opcodes.INEG && opcode <= Opcodes.DNEG) {
            expr(NodeKind.ARITH, "neg", 1);
        } else if (opcode >= Opcodes.IADD && opcode <= Opcodes.LXOR) {
            expr(NodeKind.ARITH, arithName(opcode), 2);
        } else if (opcode >= Opcodes.I2L && opcode <= Opcodes.I2S) {
            expr(NodeKind.CONVERT, null, 1);
        } else if (opcode >= Opcodes.LCMP && opcode <= Opcodes.DCMPG) {
            expr(NodeKind.ARITH, "cmp", 2);
        } else if (opcode >= Opcodes.IRETURN && opcode <= Opcodes.ARETURN) {
            stmt(NodeKind.RETURN, null, 1);
        } else if (opcode == Opcodes.RETURN) {
            stmt(NodeKind.RETURN, null, 0);
        } else if (opcode == Opcodes.ARRAYLENGTH) {
            expr(NodeKind.ARITH, "length", 1);
        } else if (opcode == Opcodes.ATHROW) {
            stmt(NodeKind.THROW, null, 1);
        } else if (opcode == Opcodes.MONITORENTER || opcode == Opcodes.MONITOREXIT) {
            stmt(NodeKind.OTHER, "monitor", 1);
        } else {
            stmt(NodeKind.OTHER, "opcode " + opcode, 0);
        }
    }

    private static String arithName(int opcode) {
        if (opcode <= Opcodes.DADD) return "add";
        if (opcode <= Opcodes.DSUB) return "sub";
        if (opcode <= Opcodes.DMUL) return "mul";
        if (opcode <= Opcodes.DDIV) return "div";
        if (opcode <= Opcodes.DREM) return "rem";
        if (opcode <= Opcodes.LSHL) return "shl";
        if (opcode <= Opcodes.LSHR) return "shr";
        if (opcode <= Opcodes.LUSHR) return "ushr";
        if (opcode <= Opcodes.LAND) return "and";
        if (opcode <= Opcodes.LOR) return "or";
        return "xor";
    }

    @Override
    public void visitIntInsn(int opcode, int operand) {
        if (opcode == Opcodes.NEWARRAY) {
            expr(NodeKind.NEW, "array", 1);
        } else {
            // BIPUSH, SIPUSH
            push(Node.leaf(NodeKind.CONST, String.valueOf(operand), line));
        }
    }

    @Override
    public void visitVarInsn(int opcode, int varIndex) {
        if (opcode >= Opcodes.ILOAD && opcode <= Opcodes.ALOAD) {
            push(Node.leaf(NodeKind.LOAD, String.valueOf(varIndex), line));
        } else if (opcode >= Opcodes.ISTORE && opcode <= Opcodes.ASTORE) {
            stmt(NodeKind.STORE, String.valueOf(varIndex), 1);
        } else {
            stmt(NodeKind.OTHER, "ret", 0);
        }
    }

    @Override
    public void visitIincInsn(int varIndex, int increment) {
        stmt(NodeKind.STORE, String.valueOf(varIndex), 0);
    }

    @Override
    public void visitTypeInsn(int opcode, String type) {
        String typeFqn = DescriptorParser.toFqn(type);
        if (opcode == Opcodes.NEW) {
            // Completed when the matching <init> call is seen
            Node pending = Node.leaf(NodeKind.NEW, typeFqn, line);
            pendingNews.add(pending);
            push(pending);
        } else if (opcode == Opcodes.ANEWARRAY) {
            expr(NodeKind.NEW, typeFqn + "[]", 1);
        } else if (opcode == Opcodes.CHECKCAST) {
            expr(NodeKind.CONVERT, typeFqn, 1);
        } else {
            // INSTANCEOF
            expr(NodeKind.CONVERT, "instanceof " + typeFqn, 1);
        }
    }

    @Override
    public void visitFieldInsn(int opcode, String owner, String name, String descriptor) {
        String field = DescriptorParser.toFqn(owner) + "." + name;
        switch (opcode) {
            case Opcodes.GETSTATIC -> push(Node.leaf(NodeKind.FIELD, field, line));
            case Opcodes.GETFIELD -> expr(NodeKind.FIELD, field, 1);
            case Opcodes.PUTSTATIC -> stmt(NodeKind.STORE, field, 1);
            default -> stmt(NodeKind.STORE, field, 2);
        }
    }

    @Override
    public void visitMethodInsn(int opcode, String owner, String name, String descriptor, boolean isInterface) {
        int argc = DescriptorParser.parseParameterTypes(descriptor).size();
        List<Node> args = popN(argc);
        Node receiver = opcode == Opcodes.INVOKESTATIC ? null : pop();

        if (opcode == Opcodes.INVOKESPECIAL && "<init>".equals(name)
                && receiver != null && pendingNews.remove(receiver)) {
            Node allocated = new Node(NodeKind.NEW, receiver.operand(), null, receiver.line(), args);
            if (!replace(receiver, allocated)) {
                emit(allocated);
            }
            return;
        }

        List<Node> children = new ArrayList<>(argc + 1);
        if (receiver != null) {
            children.add(receiver);
        }
        children.addAll(args);
        Node call = Node.builder(NodeKind.CALL)
                .operand(MethodRef.ofInternal(owner, name, descriptor).key())
                .invokeType(invokeType(opcode))
                .line(line)
                .children(children)
                .build();
        if (DescriptorParser.returnsVoid(descriptor)) {
            emit(call);
        } else {
            push(call);
        }
    }

    private static InvokeType invokeType(int opcode) {
        return switch (opcode) {
            case Opcodes.INVOKEINTERFACE -> InvokeType.INTERFACE;
            case Opcodes.INVOKESTATIC -> InvokeType.STATIC;
            case Opcodes.INVOKESPECIAL -> InvokeType.SPECIAL;
            default -> InvokeType.VIRTUAL;
        };
    }

    @Override
    public void visitInvokeDynamicInsn(String name, String descriptor, Handle bootstrapMethodHandle,
                                       Object... bootstrapMethodArguments) {
        List<Node> captured = popN(DescriptorParser.parseParameterTypes(descriptor).size());
        Node node;
        if (LAMBDA_METAFACTORY.equals(bootstrapMethodHandle.getOwner())
                && bootstrapMethodArguments.length >= 2
                && bootstrapMethodArguments[1] instanceof Handle impl) {
            // Lambda or method reference: the closure is identified by its implementation method
            String target = MethodRef.ofInternal(impl.getOwner(), impl.getName(), impl.getDesc()).key();
            node = new Node(NodeKind.CLOSURE, target, null, line, captured);
        } else {
            node = new Node(NodeKind.OTHER, "indy " + name, null, line, captured);
        }
        if (DescriptorParser.returnsVoid(descriptor)) {
            emit(node);
        } else {
            push(node);
        }
    }

    @Override
    public void visitJumpInsn(int opcode, Label label) {
        targets.add(label);
        if (opcode == Opcodes.GOTO) {
            if (visited.contains(label)) {
                flushStack();
            } else {
                carryTo(label);
            }
            stack.clear();
            stmt(NodeKind.JUMP, null, 0);
        } else if (opcode == Opcodes.JSR) {
            stmt(NodeKind.OTHER, "jsr", 0);
        } else {
            // IF_ICMPxx and IF_ACMPxx compare two values; IFxx, IFNULL, IFNONNULL one
            int operands = opcode >= Opcodes.IF_ICMPEQ && opcode <= Opcodes.IF_ACMPNE ? 2 : 1;
            Node branch = new Node(NodeKind.BRANCH, null, null, line, popN(operands));
            carryTo(label);
            emit(branch);
        }
    }

    @Override
    public void visitLdcInsn(Object value) {
        String text = value instanceof String s ? "\"" + s + "\"" : String.valueOf(value);
        push(Node.leaf(NodeKind.CONST, text, line));
    }

    @Override
    public void visitTableSwitchInsn(int min, int max, Label dflt, Label... labels) {
        switchTo(dflt, labels);
    }

    @Override
    public void visitLookupSwitchInsn(Label dflt, int[] keys, Label[] labels) {
        switchTo(dflt, labels);
    }

    private void switchTo(Label dflt, Label[] labels) {
        Node key = new Node(NodeKind.SWITCH, null, null, line, popN(1));
        carryTo(dflt);
        targets.add(dflt);
        for (Label label : labels) {
            carryTo(label);
            targets.add(label);
        }
        stack.clear();
        emit(key);
    }

    /**
     * Records the current stack as arriving at a forward jump target.
     */
    private void carryTo(Label target) {
        if (stack.isEmpty() || visited.contains(target)) {
            return;
        }
        carried.computeIfAbsent(target, k -> new ArrayList<>()).add(List.copyOf(stack));
    }

    @Override
    public void visitMultiANewArrayInsn(String descriptor, int numDimensions) {
        expr(NodeKind.NEW, descriptor, numDimensions);
    }

    @Override
    public void visitTryCatchBlock(Label start, Label end, Label handler, String type) {
        handlers.add(handler);
        targets.add(handler);
    }

    @Override
    public void visitLabel(Label label) {
        List<List<Node>> incoming = carried.remove(label);
        if (incoming != null) {
            if (reachable) {
                incoming.add(List.copyOf(stack));
            } else {
                flushStack();
            }
            List<Node> joined = join(incoming);
            stack.clear();
            stack.addAll(joined);
        }
        if (handlers.contains(label)) {
            // The JVM clears the stack on entry to a handler
            flushStack();
        }
        if (targets.contains(label)) {
            endBlock();
        }
        if (handlers.contains(label)) {
            // and pushes the caught exception
            push(Node.leaf(NodeKind.OTHER, "caught", line));
        }
        visited.add(label);
        reachable = true;
    }

    /**
     * Joins the stacks of every path reaching a label, slot by slot from the top.
     * A slot holding the same node on every path keeps it.
     */
    private List<Node> join(List<List<Node>> incoming) {
        int depth = Integer.MAX_VALUE;
        for (List<Node> s : incoming) {
            depth = Math.min(depth, s.size());
        }
        List<Node> joined = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++) {
            List<Node> alternatives = new ArrayList<>();
            for (List<Node> s : incoming) {
                Node value = s.get(s.size() - depth + i);
                if (alternatives.stream().noneMatch(a -> a == value)) {
                    alternatives.add(value);
                }
            }
            joined.add(alternatives.size() == 1
                    ? alternatives.get(0)
                    : new Node(NodeKind.MERGE, null, null, line, alternatives));
        }
        return joined;
    }

    @Override
    public void visitLineNumber(int lineNumber, Label start) {
        this.line = lineNumber;
        if (firstLine == 0) {
            firstLine = lineNumber;
        }
    }

    @Override
    public void visitEnd() {
        for (Node leftover : stack) {
            current.add(leftover);
        }
        stack.clear();
        endBlock();
        root = new Node(NodeKind.FUNC, methodName, null, firstLine, blocks);
    }

    /**
     * Returns the built tree, or null before {@link #visitEnd()}.
     */
    public Node root() {
        return root;
    }

    /**
     * First source line seen in the method, or 0 without line information.
     */
    public int firstLine() {
        return firstLine;
    }

    private void push(Node n) {
        stack.add(n);
    }

    private Node pop() {
        return stack.isEmpty() ? null : stack.remove(stack.size() - 1);
    }

    /**
     * Pops n values and returns them in push order.
     */
    private List<Node> popN(int n) {
        List<Node> values = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Node v = pop();
            if (v != null) {
                values.add(0, v);
            }
        }
        return values;
    }

    private void dup() {
        if (stack.isEmpty()) {
            return;
        }
        Node top = stack.get(stack.size() - 1);
        if (pendingNews.contains(top)) {
            // NEW; DUP; <init> leaves one reference to the initialized object
            push(top);
        } else {
            push(Node.leaf(NodeKind.DUP, top.kind().name(), line));
        }
    }

    private boolean replace(Node old, Node replacement) {
        for (int i = stack.size() - 1; i >= 0; i--) {
            if (stack.get(i) == old) {
                stack.set(i, replacement);
                return true;
            }
        }
        return false;
    }

    private void expr(NodeKind kind, String operand, int operands) {
        List<Node> children = popN(operands);
        push(new Node(kind, operand, null, line, children));
    }

    private void stmt(NodeKind kind, String operand, int operands) {
        List<Node> children = popN(operands);
        emit(new Node(kind, operand, null, line, children));
    }

    private void emit(Node statement) {
        current.add(statement);
        if (statement.kind().endsBlock()) {
            endBlock();
            if (!statement.is(NodeKind.BRANCH)) {
                reachable = false;
            }
        }
    }

    /**
     * Turns the values left on the stack into statements.
     */
    private void flushStack() {
        List<Node> leftovers = new ArrayList<>(stack);
        stack.clear();
        for (Node leftover : leftovers) {
            emit(leftover);
        }
    }

    private void endBlock() {
        if (current.isEmpty()) {
            return;
        }
        int blockLine = current.get(0).line();
        blocks.add(new Node(NodeKind.BLOCK, null, null, blockLine, current));
        current = new ArrayList<>();
    }
}
