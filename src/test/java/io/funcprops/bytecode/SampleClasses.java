package io.funcprops.bytecode;

import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Generates the class files the bytecode tests scan. The equivalent source:
 * <pre>
 * public class Sample {
 *     static int one() { return 1; }                                  // line 10
 *     static Object make() { return new Object(); }                   // line 14
 *     static void fail(String msg) { throw new IllegalStateException(msg); } // line 18
 *     int check(Runnable r, int x) { if (x != 0) r.run(); return 0; } // lines 22, 24
 *     static int exit() { System.exit(1); return 0; }                 // line 28
 *     static void loop() { while (true) { } }                         // line 32
 *     static int guarded() { try { return 1; } catch (Exception e) { return 0; } } // lines 36, 38
 *     static Supplier&lt;Object&gt; sup() { return () -&gt; null; }   // line 42
 *     // plus a bridge method and a native method
 * }
 * </pre>
 */
public final class SampleClasses {

    public static final String SAMPLE = "com/example/Sample";

    private static final String METAFACTORY_DESC = "(Ljava/lang/invoke/MethodHandles$Lookup;Ljava/lang/String;"
            + "Ljava/lang/invoke/MethodType;Ljava/lang/invoke/MethodType;Ljava/lang/invoke/MethodHandle;"
            + "Ljava/lang/invoke/MethodType;)Ljava/lang/invoke/CallSite;";

    private SampleClasses() {
    }

    public static byte[] sample() {
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_MAXS);
        cw.visit(Opcodes.V1_8, Opcodes.ACC_PUBLIC | Opcodes.ACC_SUPER, SAMPLE, null, "java/lang/Object", null);
        cw.visitSource("Sample.java", null);

        MethodVisitor mv = begin(cw, Opcodes.ACC_STATIC, "one", "()I", 10);
        mv.visitInsn(Opcodes.ICONST_1);
        mv.visitInsn(Opcodes.IRETURN);
        end(mv);

        mv = begin(cw, Opcodes.ACC_STATIC, "make", "()Ljava/lang/Object;", 14);
        mv.visitTypeInsn(Opcodes.NEW, "java/lang/Object");
        mv.visitInsn(Opcodes.DUP);
        mv.visitMethodInsn(Opcodes.INVOKESPECIAL, "java/lang/Object", "<init>", "()V", false);
        mv.visitInsn(Opcodes.ARETURN);
        end(mv);

        mv = begin(cw, Opcodes.ACC_STATIC, "fail", "(Ljava/lang/String;)V", 18);
        mv.visitTypeInsn(Opcodes.NEW, "java/lang/IllegalStateException");
        mv.visitInsn(Opcodes.DUP);
        mv.visitVarInsn(Opcodes.ALOAD, 0);
        mv.visitMethodInsn(Opcodes.INVOKESPECIAL, "java/lang/IllegalStateException", "<init>",
                "(Ljava/lang/String;)V", false);
        mv.visitInsn(Opcodes.ATHROW);
        end(mv);

        mv = begin(cw, 0, "check", "(Ljava/lang/Runnable;I)I", 22);
        Label skip = new Label();
        mv.visitVarInsn(Opcodes.ILOAD, 2);
        mv.visitJumpInsn(Opcodes.IFEQ, skip);
        mv.visitVarInsn(Opcodes.ALOAD, 1);
        mv.visitMethodInsn(Opcodes.INVOKEINTERFACE, "java/lang/Runnable", "run", "()V", true);
        mv.visitLabel(skip);
        mv.visitLineNumber(24, skip);
        mv.visitInsn(Opcodes.ICONST_0);
        mv.visitInsn(Opcodes.IRETURN);
        end(mv);

        mv = begin(cw, Opcodes.ACC_STATIC, "exit", "()I", 28);
        mv.visitInsn(Opcodes.ICONST_1);
        mv.visitMethodInsn(Opcodes.INVOKESTATIC, "java/lang/System", "exit", "(I)V", false);
        mv.visitInsn(Opcodes.ICONST_0);
        mv.visitInsn(Opcodes.IRETURN);
        end(mv);

        mv = cw.visitMethod(Opcodes.ACC_STATIC, "loop", "()V", null, null);
        mv.visitCode();
        Label top = new Label();
        mv.visitLabel(top);
        mv.visitLineNumber(32, top);
        mv.visitJumpInsn(Opcodes.GOTO, top);
        end(mv);

        mv = cw.visitMethod(Opcodes.ACC_STATIC, "guarded", "()I", null, null);
        mv.visitCode();
        Label start = new Label();
        Label stop = new Label();
        Label handler = new Label();
        mv.visitTryCatchBlock(start, stop, handler, "java/lang/Exception");
        mv.visitLabel(start);
        mv.visitLineNumber(36, start);
        mv.visitInsn(Opcodes.ICONST_1);
        mv.visitInsn(Opcodes.IRETURN);
        mv.visitLabel(stop);
        mv.visitLabel(handler);
        mv.visitLineNumber(38, handler);
        mv.visitVarInsn(Opcodes.ASTORE, 0);
        mv.visitInsn(Opcodes.ICONST_0);
        mv.visitInsn(Opcodes.IRETURN);
        end(mv);

        mv = begin(cw, Opcodes.ACC_STATIC, "sup", "()Ljava/util/function/Supplier;", 42);
        mv.visitInvokeDynamicInsn("get", "()Ljava/util/function/Supplier;",
                new Handle(Opcodes.H_INVOKESTATIC, "java/lang/invoke/LambdaMetafactory", "metafactory",
                        METAFACTORY_DESC, false),
                Type.getType("()Ljava/lang/Object;"),
                new Handle(Opcodes.H_INVOKESTATIC, SAMPLE, "lambda$sup$0", "()Ljava/lang/Object;", false),
                Type.getType("()Ljava/lang/Object;"));
        mv.visitInsn(Opcodes.ARETURN);
        end(mv);

        mv = begin(cw, Opcodes.ACC_STATIC | Opcodes.ACC_PRIVATE | Opcodes.ACC_SYNTHETIC,
                "lambda$sup$0", "()Ljava/lang/Object;", 42);
        mv.visitInsn(Opcodes.ACONST_NULL);
        mv.visitInsn(Opcodes.ARETURN);
        end(mv);

        mv = begin(cw, Opcodes.ACC_PUBLIC | Opcodes.ACC_BRIDGE | Opcodes.ACC_SYNTHETIC, "bridged", "()V", 46);
        mv.visitInsn(Opcodes.RETURN);
        end(mv);

        cw.visitMethod(Opcodes.ACC_STATIC | Opcodes.ACC_NATIVE, "nat", "()V", null, null).visitEnd();

        cw.visitEnd();
        return cw.toByteArray();
    }

    /**
     * An abstract class with no method bodies.
     */
    public static byte[] shape() {
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_MAXS);
        cw.visit(Opcodes.V1_8, Opcodes.ACC_PUBLIC | Opcodes.ACC_ABSTRACT, "com/example/shapes/Shape",
                null, "java/lang/Object", null);
        cw.visitMethod(Opcodes.ACC_PUBLIC | Opcodes.ACC_ABSTRACT, "area", "()D", null, null).visitEnd();
        cw.visitEnd();
        return cw.toByteArray();
    }

    /**
     * Writes the sample classes below {@code dir} in package directories.
     */
    public static Path writeClasses(Path dir) throws IOException {
        Path sample = dir.resolve(SAMPLE + ".class");
        Files.createDirectories(sample.getParent());
        Files.write(sample, sample());
        Path shape = dir.resolve("com/example/shapes/Shape.class");
        Files.createDirectories(shape.getParent());
        Files.write(shape, shape());
        return dir;
    }

    private static MethodVisitor begin(ClassWriter cw, int access, String name, String descriptor, int line) {
        MethodVisitor mv = cw.visitMethod(access, name, descriptor, null, null);
        mv.visitCode();
        Label first = new Label();
        mv.visitLabel(first);
        mv.visitLineNumber(line, first);
        return mv;
    }

    private static void end(MethodVisitor mv) {
        mv.visitMaxs(0, 0);
        mv.visitEnd();
    }
}
