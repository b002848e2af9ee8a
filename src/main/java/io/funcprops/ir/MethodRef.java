package io.funcprops.ir;

/**
 * Reference to a method, as used by call and closure nodes.
 *
 * @param classFqn   Fully qualified class name
 * @param methodName Method name
 * @param descriptor JVM method descriptor
 */
public record MethodRef(
    String classFqn,
    String methodName,
    String descriptor
) {
    /**
     * Returns the key string call and closure nodes carry as their operand.
     */
    public String key() {
        return classFqn + "." + methodName + descriptor;
    }

    /**
     * Creates a reference from an ASM internal owner name (e.g. "java/lang/System").
     */
    public static MethodRef ofInternal(String owner, String methodName, String descriptor) {
        return new MethodRef(owner.replace('/', '.'), methodName, descriptor);
    }

    @Override
    public String toString() {
        return key();
    }
}
