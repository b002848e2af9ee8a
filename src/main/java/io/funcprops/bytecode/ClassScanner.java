package io.funcprops.bytecode;

import io.funcprops.ir.Function;
import io.funcprops.ir.MethodRef;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

import java.util.ArrayList;
import java.util.List;

/**
 * ClassVisitor that turns every method with a body into a {@link Function}.
 * <p>
 * Functions are named {@code SimpleClass.method}. Synthetic bridge methods get
 * the reserved {@code .bridge.} prefix so that dumps leave them out.
 */
public class ClassScanner extends ClassVisitor {

    /** Name prefix of compiler-generated bridge methods. */
    public static final String BRIDGE_PREFIX = ".bridge.";

    private String className;
    private String sourceFile;
    private final List<Function> functions = new ArrayList<>();

    public ClassScanner() {
        super(Opcodes.ASM9);
    }

    /**
     * Reads one class file and returns its functions in class file order.
     */
    public static List<Function> scan(byte[] classBytes) {
        ClassScanner scanner = new ClassScanner();
        new ClassReader(classBytes).accept(scanner, 0);
        return scanner.functions();
    }

    @Override
    public void visit(int version, int access, String name, String signature,
                      String superName, String[] interfaces) {
        this.className = DescriptorParser.toFqn(name);
        super.visit(version, access, name, signature, superName, interfaces);
    }

    @Override
    public void visitSource(String source, String debug) {
        this.sourceFile = source;
    }

    @Override
    public MethodVisitor visitMethod(int access, String name, String descriptor,
                                     String signature, String[] exceptions) {
        // Abstract and native methods have no body to analyze
        if ((access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) {
            return null;
        }
        boolean isStatic = (access & Opcodes.ACC_STATIC) != 0;
        boolean isBridge = (access & Opcodes.ACC_BRIDGE) != 0;

        String simpleClass = DescriptorParser.simpleName(className);
        String functionName = (isBridge ? BRIDGE_PREFIX : "") + simpleClass + "." + name;
        FunctionTreeBuilder treeBuilder = new FunctionTreeBuilder(name);

        return new MethodVisitor(Opcodes.ASM9, treeBuilder) {
            @Override
            public void visitEnd() {
                super.visitEnd();

                Function fn = Function.builder()
                        .name(functionName)
                        .file(sourceFile != null ? sourceFile : outerSimpleName(simpleClass) + ".java")
                        .line(treeBuilder.firstLine())
                        .root(treeBuilder.root())
                        .ref(new MethodRef(className, name, descriptor))
                        .paramSlots(DescriptorParser.parameterSlots(descriptor, isStatic))
                        .resultCount(DescriptorParser.returnsVoid(descriptor) ? 0 : 1)
                        .build();
                functions.add(fn);
            }
        };
    }

    private static String outerSimpleName(String simpleClass) {
        int dollar = simpleClass.indexOf('$');
        return dollar > 0 ? simpleClass.substring(0, dollar) : simpleClass;
    }

    /**
     * Returns the functions found so far, in class file order.
     */
    public List<Function> functions() {
        return List.copyOf(functions);
    }

    public String getClassName() {
        return className;
    }
}
