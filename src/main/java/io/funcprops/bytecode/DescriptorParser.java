package io.funcprops.bytecode;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility for parsing JVM method descriptors.
 * <p>
 * Method descriptors follow the format: (ParameterTypes)ReturnType, with
 * B C D F I J S Z V for primitives and void, L&lt;classname&gt;; for objects
 * and a [ prefix for arrays.
 */
public final class DescriptorParser {

    private DescriptorParser() {
        // Utility class
    }

    /**
     * Parses a method descriptor and returns the parameter types as FQNs.
     * Primitive types are returned as their Java names (int, boolean, etc.).
     *
     * @param descriptor The method descriptor (e.g., "(Ljava/lang/String;I)V")
     * @return List of parameter type names in order
     */
    public static List<String> parseParameterTypes(String descriptor) {
        List<String> types = new ArrayList<>();

        if (descriptor == null || !descriptor.startsWith("(")) {
            return types;
        }
        int endParams = descriptor.indexOf(')');
        if (endParams < 0) {
            return types;
        }

        int pos = 1;
        while (pos < endParams) {
            ParseResult result = parseType(descriptor, pos);
            if (result == null) {
                break;
            }
            types.add(result.type());
            pos = result.endPos();
        }
        return types;
    }

    /**
     * Parses the return type from a method descriptor.
     *
     * @return The return type name, or null if the descriptor is invalid
     */
    public static String parseReturnType(String descriptor) {
        if (descriptor == null) {
            return null;
        }
        int returnStart = descriptor.indexOf(')');
        if (returnStart < 0 || returnStart + 1 >= descriptor.length()) {
            return null;
        }
        ParseResult result = parseType(descriptor, returnStart + 1);
        return result != null ? result.type() : null;
    }

    /**
     * Returns true if the method returns nothing.
     */
    public static boolean returnsVoid(String descriptor) {
        return "void".equals(parseReturnType(descriptor));
    }

    /**
     * Returns the local variable slot of every declared parameter. Slot 0 holds
     * 'this' for instance methods; long and double take two slots.
     */
    public static List<Integer> parameterSlots(String descriptor, boolean isStatic) {
        List<Integer> slots = new ArrayList<>();
        int slot = isStatic ? 0 : 1;
        for (String type : parseParameterTypes(descriptor)) {
            slots.add(slot);
            slot += ("double".equals(type) || "long".equals(type)) ? 2 : 1;
        }
        return slots;
    }

    /**
     * Converts an internal name (java/util/Map$Entry) to a FQN (java.util.Map$Entry).
     */
    public static String toFqn(String internalName) {
        return internalName == null ? null : internalName.replace('/', '.');
    }

    /**
     * Returns the part of a FQN after the last dot.
     */
    public static String simpleName(String fqn) {
        int dot = fqn.lastIndexOf('.');
        return dot >= 0 ? fqn.substring(dot + 1) : fqn;
    }

    private static ParseResult parseType(String descriptor, int pos) {
        if (pos >= descriptor.length()) {
            return null;
        }
        char c = descriptor.charAt(pos);
        String primitive = switch (c) {
            case 'B' -> "byte";
            case 'C' -> "char";
            case 'D' -> "double";
            case 'F' -> "float";
            case 'I' -> "int";
            case 'J' -> "long";
            case 'S' -> "short";
            case 'Z' -> "boolean";
            case 'V' -> "void";
            default -> null;
        };
        if (primitive != null) {
            return new ParseResult(primitive, pos + 1);
        }

        if (c == '[') {
            ParseResult elementType = parseType(descriptor, pos + 1);
            if (elementType == null) {
                return null;
            }
            return new ParseResult(elementType.type() + "[]", elementType.endPos());
        }

        if (c == 'L') {
            int semicolon = descriptor.indexOf(';', pos);
            if (semicolon < 0) {
                return null;
            }
            return new ParseResult(toFqn(descriptor.substring(pos + 1, semicolon)), semicolon + 1);
        }
        return null;
    }

    private record ParseResult(String type, int endPos) {
    }
}
