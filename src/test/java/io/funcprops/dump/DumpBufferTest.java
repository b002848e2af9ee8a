package io.funcprops.dump;

import io.funcprops.analysis.AnalyzerRegistry;
import io.funcprops.analysis.FuncFlagsAnalyzer;
import io.funcprops.analysis.FuncPropsComputer;
import io.funcprops.analysis.InlineEligibility;
import io.funcprops.analysis.ResultsAnalyzer;
import io.funcprops.ir.Function;
import io.funcprops.ir.Node;
import io.funcprops.ir.NodeKind;
import io.funcprops.ir.PositionResolver;
import io.funcprops.props.FuncPropBits;
import io.funcprops.props.FuncProps;
import io.funcprops.props.ResultPropBits;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.funcprops.ir.Trees.alloc;
import static io.funcprops.ir.Trees.block;
import static io.funcprops.ir.Trees.constant;
import static io.funcprops.ir.Trees.func;
import static io.funcprops.ir.Trees.function;
import static io.funcprops.ir.Trees.ret;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DumpBufferTest {

    private static final String PREAMBLE =
            "// DO NOT EDIT (use 'mvn test -Dfuncprops.updateExpected=true' instead.)\n"
                    + "// See src/test/resources/props/README.txt\n"
                    + "// for more information on the format of this file.\n"
                    + "// <endfilepreamble>\n";

    @TempDir
    Path tempDir;

    private static DumpBuffer newBuffer() {
        return new DumpBuffer(FuncPropsComputer.createDefault(InlineEligibility.never(), Set.of()));
    }

    private static Function simple(String name, int line) {
        return function(name, line, func(block(ret())));
    }

    @Test
    void capture_isIdempotentPerFunction() {
        DumpBuffer buffer = newBuffer();
        Function fn = simple("Sample.f", 4);

        assertThat(buffer.capture(fn)).isTrue();
        assertThat(buffer.capture(fn)).isFalse();

        assertThat(buffer.size()).isEqualTo(1);
        assertThat(buffer.contains(fn)).isTrue();
    }

    @Test
    void capture_keysOnIdentityNotName() {
        DumpBuffer buffer = newBuffer();

        buffer.capture(simple("Sample.f", 4));
        buffer.capture(simple("Sample.f", 4));

        assertThat(buffer.size()).isEqualTo(2);
    }

    @Test
    void capture_skipsReservedNames() {
        DumpBuffer buffer = newBuffer();
        Function eq = simple(".eq.Sample", 2);
        Function bridge = simple(".bridge.Sample.get", 2);

        assertThat(buffer.capture(eq)).isFalse();
        assertThat(buffer.capture(bridge)).isFalse();

        assertThat(buffer.contains(eq)).isFalse();
        assertThat(buffer.isInitialized()).isFalse();
    }

    @Test
    void capture_usesConfiguredReservedPrefixes() {
        DumpBuffer buffer = new DumpBuffer(
                FuncPropsComputer.createDefault(InlineEligibility.never(), Set.of()),
                PositionResolver.basename(), List.of("gen."));

        assertThat(buffer.capture(simple("gen.Thing", 1))).isFalse();
        assertThat(buffer.capture(simple(".eq.Sample", 1))).isTrue();
    }

    @Test
    void capture_recordsBasenameAndLine() {
        DumpBuffer buffer = newBuffer();

        buffer.capture(simple("Sample.f", 12));

        DumpEntry entry = buffer.entries().get(0);
        assertThat(entry.name()).isEqualTo("Sample.f");
        assertThat(entry.file()).isEqualTo("Sample.java");
        assertThat(entry.line()).isEqualTo(12);
    }

    @Test
    void capture_computesEachFunctionOnce() {
        AtomicInteger created = new AtomicInteger();
        FuncPropsComputer computer = new FuncPropsComputer(AnalyzerRegistry.of((fn, trace) -> {
            created.incrementAndGet();
            return new FuncFlagsAnalyzer(fn, trace);
        }));
        DumpBuffer buffer = new DumpBuffer(computer);
        Function fn = simple("Sample.f", 1);

        buffer.capture(fn);
        buffer.capture(fn);

        assertThat(created).hasValue(1);
    }

    @Test
    void flush_ordersByLineThenNameWithIndexAndCount() throws Exception {
        DumpBuffer buffer = newBuffer();
        buffer.capture(simple("x", 5));
        buffer.capture(simple("c", 3));
        buffer.capture(simple("a", 3));
        buffer.capture(simple("b", 3));
        Path dump = tempDir.resolve("props.dump");

        buffer.flush(dump);

        List<DumpReader.Entry> entries = DumpReader.read(dump);
        assertThat(entries).extracting(DumpReader.Entry::name).containsExactly("a", "b", "c", "x");
        assertThat(entries).extracting(DumpReader.Entry::line).containsExactly(3, 3, 3, 5);
        assertThat(entries).extracting(DumpReader.Entry::index).containsExactly(0, 1, 2, 0);
        assertThat(entries).extracting(DumpReader.Entry::count).containsExactly(3, 3, 3, 1);
    }

    @Test
    void flush_isIndependentOfCaptureOrder() throws Exception {
        DumpBuffer first = newBuffer();
        first.capture(simple("b", 7));
        first.capture(simple("a", 7));
        first.capture(simple("z", 1));
        DumpBuffer second = newBuffer();
        second.capture(simple("z", 1));
        second.capture(simple("a", 7));
        second.capture(simple("b", 7));
        Path one = tempDir.resolve("one.dump");
        Path two = tempDir.resolve("two.dump");

        first.flush(one);
        second.flush(two);

        assertThat(Files.readString(one)).isEqualTo(Files.readString(two));
    }

    @Test
    void flush_emptyBufferWritesOnlyThePreamble() throws Exception {
        DumpBuffer buffer = newBuffer();
        Path dump = tempDir.resolve("empty.dump");

        buffer.flush(dump);

        assertThat(Files.readString(dump, StandardCharsets.UTF_8)).isEqualTo(PREAMBLE);
        assertThat(DumpReader.read(dump)).isEmpty();
    }

    @Test
    void flush_truncatesExistingFile() throws Exception {
        Path dump = tempDir.resolve("props.dump");
        Files.writeString(dump, "stale content that is longer than nothing\n".repeat(50));

        newBuffer().flush(dump);

        assertThat(Files.readString(dump)).isEqualTo(PREAMBLE);
    }

    @Test
    void flush_resetsTheBuffer() {
        DumpBuffer buffer = newBuffer();
        Function fn = simple("Sample.f", 1);
        buffer.capture(fn);

        buffer.flush(tempDir.resolve("props.dump"));

        assertThat(buffer.isInitialized()).isFalse();
        assertThat(buffer.contains(fn)).isFalse();
        assertThat(buffer.capture(fn)).isTrue();
    }

    @Test
    void flush_unwritablePathIsFatal() throws Exception {
        Path notADirectory = tempDir.resolve("file");
        Files.writeString(notADirectory, "x");
        DumpBuffer buffer = newBuffer();
        buffer.capture(simple("Sample.f", 1));

        assertThatThrownBy(() -> buffer.flush(notADirectory.resolve("props.dump")))
                .isInstanceOf(FatalDumpException.class)
                .hasMessageContaining("writing function props dump file");
        assertThat(buffer.isInitialized()).isFalse();
    }

    @Test
    void flush_writesRenderedAndJsonProps() throws Exception {
        DumpBuffer buffer = newBuffer();
        buffer.capture(function("Sample.fail", 9, func(block(Node.of(NodeKind.THROW, alloc("java.lang.Error"))))));
        Path dump = tempDir.resolve("props.dump");

        buffer.flush(dump);

        assertThat(Files.readString(dump)).isEqualTo(PREAMBLE
                + "// Sample.java Sample.fail 9 0 1\n"
                + "// Flags FuncPropNeverReturns\n"
                + "// <endpropsdump>\n"
                + "// {\"flags\":[\"NEVER_RETURNS\"],\"paramFlags\":[],\"resultFlags\":[]}\n"
                + "// <endfuncpreamble>\n");
    }

    /**
     * Three functions, two on one line, analyzed by two independent analyzers.
     */
    @Test
    void endToEnd_twoAnalyzersMergedPerFunction() throws Exception {
        Function foo = returning("foo", 10, func(block(ret(alloc("java.util.ArrayList")))));
        Function bar = returning("bar", 10, func(block(Node.of(NodeKind.THROW, alloc("java.lang.Error")))));
        Function baz = returning("baz", 20, func(block(ret(constant("1")))));
        FuncPropsComputer computer = new FuncPropsComputer(AnalyzerRegistry.of(
                FuncFlagsAnalyzer::new,
                (fn, trace) -> new ResultsAnalyzer(fn, InlineEligibility.never(), trace)));
        DumpBuffer buffer = new DumpBuffer(computer);
        buffer.capture(foo);
        buffer.capture(bar);
        buffer.capture(baz);
        Path dump = tempDir.resolve("props.dump");

        buffer.flush(dump);

        List<DumpReader.Entry> entries = DumpReader.read(dump);
        assertThat(entries).extracting(DumpReader.Entry::name).containsExactly("bar", "foo", "baz");
        assertThat(entries).extracting(DumpReader.Entry::index).containsExactly(0, 1, 0);
        assertThat(entries).extracting(DumpReader.Entry::count).containsExactly(2, 2, 1);

        FuncProps barProps = entries.get(0).props();
        assertThat(barProps.flags()).containsExactly(FuncPropBits.NEVER_RETURNS);
        assertThat(barProps.resultFlags()).containsExactly(Set.of());

        FuncProps fooProps = entries.get(1).props();
        assertThat(fooProps.flags()).isEmpty();
        assertThat(fooProps.resultFlags()).containsExactly(Set.of(ResultPropBits.IS_ALLOCATED_MEM));

        FuncProps bazProps = entries.get(2).props();
        assertThat(bazProps.resultFlags()).containsExactly(Set.of(ResultPropBits.ALWAYS_SAME_CONSTANT));
        assertThat(entries.get(2).rendered()).isEqualTo("ResultFlags\n  0 ResultAlwaysSameConstant\n");
    }

    @Test
    void capture_fromSeveralThreads() throws Exception {
        DumpBuffer buffer = newBuffer();
        List<Function> functions = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            functions.add(simple("f" + i, i));
        }
        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (Function fn : functions) {
            tasks.add(() -> buffer.capture(fn));
            tasks.add(() -> buffer.capture(fn));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        int added = 0;
        try {
            for (Future<Boolean> f : pool.invokeAll(tasks)) {
                if (f.get()) {
                    added++;
                }
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(added).isEqualTo(200);
        assertThat(buffer.size()).isEqualTo(200);
    }

    @Test
    void capture_survivesFlushWhileResolvingPosition() throws Exception {
        CountDownLatch resolving = new CountDownLatch(1);
        CountDownLatch flushed = new CountDownLatch(1);
        PositionResolver basename = PositionResolver.basename();
        PositionResolver waitForFlush = fn -> {
            resolving.countDown();
            try {
                if (!flushed.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("no flush within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return basename.resolve(fn);
        };
        DumpBuffer buffer = new DumpBuffer(FuncPropsComputer.createDefault(InlineEligibility.never(), Set.of()),
                waitForFlush, DumpBuffer.DEFAULT_RESERVED_PREFIXES);
        Function fn = simple("Sample.f", 3);
        Path dump = tempDir.resolve("mid.dump");

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> captured = pool.submit(() -> buffer.capture(fn));
            assertThat(resolving.await(5, TimeUnit.SECONDS)).isTrue();
            buffer.flush(dump);
            flushed.countDown();

            assertThat(captured.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(Files.readString(dump, StandardCharsets.UTF_8)).isEqualTo(PREAMBLE);
        assertThat(buffer.contains(fn)).isTrue();
        assertThat(buffer.entries()).extracting(DumpEntry::name).containsExactly("Sample.f");
    }

    private static Function returning(String name, int line, Node root) {
        return Function.builder()
                .name(name)
                .file("Sample.java")
                .line(line)
                .root(root)
                .resultCount(1)
                .build();
    }
}
