package io.funcprops.ir;

/**
 * Kind tag of a {@link Node}.
 * <p>
 * Expression kinds produce a value and appear as operands of other nodes;
 * statement kinds appear directly under a {@link #BLOCK}.
 */
public enum NodeKind {
    /** Root of a function body; children are blocks. */
    FUNC,
    /** Straight-line run of statements. */
    BLOCK,
    /** Literal value; operand is its text. */
    CONST,
    /** Local variable read; operand is the slot number. */
    LOAD,
    /** Local, field or array element write. */
    STORE,
    /** Field read; operand is owner.name. */
    FIELD,
    /** Array element read. */
    INDEX,
    /** Arithmetic, logic or comparison; operand is the opcode name. */
    ARITH,
    /** Cast, primitive conversion or instanceof. */
    CONVERT,
    /** Object or array allocation; operand is the allocated type. */
    NEW,
    /** Method invocation; operand is the target key. */
    CALL,
    /** Lambda or method reference; operand is the implementation method key. */
    CLOSURE,
    /** Duplicated stack value. */
    DUP,
    /** Value reaching a join point along more than one path; children are the alternatives. */
    MERGE,
    /** Method return, with the returned value as its only child if any. */
    RETURN,
    THROW,
    /** Conditional jump; children are the compared operands. */
    BRANCH,
    /** Unconditional jump. */
    JUMP,
    SWITCH,
    /** Anything the frontend does not model. */
    OTHER;

    /**
     * Returns true if this kind transfers control away from the current block.
     */
    public boolean endsBlock() {
        return this == RETURN || this == THROW || this == BRANCH
                || this == JUMP || this == SWITCH;
    }
}
