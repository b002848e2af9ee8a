package io.funcprops.bytecode;

import io.funcprops.ir.Function;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BytecodeScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void scan_directory() throws Exception {
        Path classes = SampleClasses.writeClasses(tempDir.resolve("classes"));
        BytecodeScanner scanner = new BytecodeScanner();

        List<Function> functions = scanner.scan(List.of(classes));

        assertThat(functions).extracting(Function::name).contains("Sample.one", "Sample.sup");
        assertThat(scanner.getClassesScanned()).isEqualTo(2);
        assertThat(scanner.getJarsScanned()).isZero();
    }

    @Test
    void scan_singleClassFile() throws Exception {
        Path file = tempDir.resolve("Sample.class");
        Files.write(file, SampleClasses.sample());

        List<Function> functions = new BytecodeScanner().scan(List.of(file));

        assertThat(functions).hasSize(10);
    }

    @Test
    void scan_jar() throws Exception {
        Path jar = tempDir.resolve("sample.jar");
        try (OutputStream out = Files.newOutputStream(jar);
             JarOutputStream jos = new JarOutputStream(out)) {
            jos.putNextEntry(new JarEntry("com/example/Sample.class"));
            jos.write(SampleClasses.sample());
            jos.closeEntry();
            jos.putNextEntry(new JarEntry("META-INF/versions/9/com/example/Sample.class"));
            jos.write(SampleClasses.sample());
            jos.closeEntry();
        }
        BytecodeScanner scanner = new BytecodeScanner();

        List<Function> functions = scanner.scan(List.of(jar));

        assertThat(functions).hasSize(10);
        assertThat(scanner.getJarsScanned()).isEqualTo(1);
        assertThat(scanner.getClassesScanned()).isEqualTo(1);
    }

    @Test
    void scan_excludedClassesAreSkipped() throws Exception {
        Path classes = SampleClasses.writeClasses(tempDir.resolve("classes"));
        BytecodeScanner scanner = new BytecodeScanner(name -> name.equals("com.example.Sample"));

        List<Function> functions = scanner.scan(List.of(classes));

        assertThat(functions).isEmpty();
        assertThat(scanner.getClassesScanned()).isEqualTo(1);
    }

    @Test
    void scan_malformedClassIsSkipped() throws Exception {
        Path classes = SampleClasses.writeClasses(tempDir.resolve("classes"));
        Files.write(classes.resolve("com/example/Broken.class"), new byte[]{1, 2, 3});
        BytecodeScanner scanner = new BytecodeScanner();

        List<Function> functions = scanner.scan(List.of(classes));

        assertThat(functions).hasSize(10);
        assertThat(scanner.getClassesScanned()).isEqualTo(2);
    }

    @Test
    void scan_unsupportedInputIsAnError() throws IOException {
        Path text = tempDir.resolve("notes.txt");
        Files.writeString(text, "hello");

        assertThatThrownBy(() -> new BytecodeScanner().scan(List.of(text)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("notes.txt");
    }

    @Test
    void scan_isDeterministic() throws Exception {
        Path classes = SampleClasses.writeClasses(tempDir.resolve("classes"));

        List<Function> first = new BytecodeScanner().scan(List.of(classes));
        List<Function> second = new BytecodeScanner().scan(List.of(classes));

        assertThat(first).extracting(Function::name)
                .containsExactlyElementsOf(second.stream().map(Function::name).toList());
    }

    @Test
    void pathToClassName() {
        assertThat(BytecodeScanner.pathToClassName("com/example/Sample.class")).isEqualTo("com.example.Sample");
    }
}
