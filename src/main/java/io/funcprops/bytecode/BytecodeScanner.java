package io.funcprops.bytecode;

import io.funcprops.ir.Function;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.function.Predicate;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * Scans bytecode from class files, class directories and JARs into functions.
 * <p>
 * The result order is deterministic: inputs in the given order, class files
 * sorted by path within a directory or JAR, methods in class file order.
 */
public class BytecodeScanner {

    private final Predicate<String> excluded;

    private int classesScanned = 0;
    private int jarsScanned = 0;

    public BytecodeScanner() {
        this(className -> false);
    }

    /**
     * @param excluded Tells which class FQNs to skip
     */
    public BytecodeScanner(Predicate<String> excluded) {
        this.excluded = excluded;
    }

    /**
     * Scans every input: a directory (recursively), a JAR or a single class file.
     */
    public List<Function> scan(List<Path> inputs) throws IOException {
        List<Function> functions = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                scanDirectory(input, functions);
            } else if (input.toString().endsWith(".jar")) {
                scanJar(input, functions);
            } else if (input.toString().endsWith(".class")) {
                scanClassFile(input, input.getFileName().toString(), functions);
            } else {
                throw new IOException("Not a class directory, JAR or class file: " + input);
            }
        }
        return functions;
    }

    private void scanDirectory(Path directory, List<Function> functions) throws IOException {
        List<Path> classFiles;
        try (Stream<Path> files = Files.walk(directory)) {
            classFiles = files
                    .filter(p -> p.toString().endsWith(".class"))
                    .sorted()
                    .toList();
        }
        for (Path file : classFiles) {
            String relativePath = directory.relativize(file).toString().replace('\\', '/');
            scanClassFile(file, relativePath, functions);
        }
    }

    private void scanClassFile(Path file, String relativePath, List<Function> functions) throws IOException {
        String className = pathToClassName(relativePath);
        if (excluded.test(className)) {
            return;
        }
        byte[] bytes = Files.readAllBytes(file);
        scanClass(bytes, className, file.getFileName().toString(), functions);
    }

    private void scanJar(Path jarPath, List<Function> functions) throws IOException {
        try (JarFile jarFile = new JarFile(jarPath.toFile())) {
            jarsScanned++;

            List<JarEntry> classEntries = new ArrayList<>();
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                String name = entry.getName();
                if (name.endsWith(".class") && !name.startsWith("META-INF/")) {
                    classEntries.add(entry);
                }
            }
            classEntries.sort((a, b) -> a.getName().compareTo(b.getName()));

            for (JarEntry entry : classEntries) {
                String className = pathToClassName(entry.getName());
                if (excluded.test(className)) {
                    continue;
                }
                byte[] bytes;
                try (InputStream is = jarFile.getInputStream(entry)) {
                    bytes = is.readAllBytes();
                }
                scanClass(bytes, className, jarPath.getFileName() + "!" + entry.getName(), functions);
            }
        }
    }

    private void scanClass(byte[] bytes, String className, String origin, List<Function> functions) {
        try {
            functions.addAll(ClassScanner.scan(bytes));
            classesScanned++;
        } catch (RuntimeException e) {
            // ASM reports malformed class files with unchecked exceptions; skip the class and continue
            System.err.println("Warning: Failed to scan class " + className + " from " + origin + ": " + e);
        }
    }

    /**
     * Converts a path like com/example/Foo.class to com.example.Foo.
     */
    static String pathToClassName(String path) {
        String withoutExtension = path.endsWith(".class") ? path.substring(0, path.length() - 6) : path;
        return withoutExtension.replace('/', '.');
    }

    public int getClassesScanned() {
        return classesScanned;
    }

    public int getJarsScanned() {
        return jarsScanned;
    }
}
