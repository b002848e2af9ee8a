package io.funcprops;

import io.funcprops.analysis.FuncPropsComputer;
import io.funcprops.bytecode.BytecodeScanner;
import io.funcprops.bytecode.NodeBudgetEligibility;
import io.funcprops.config.AnalysisConfig;
import io.funcprops.dump.DumpBuffer;
import io.funcprops.dump.FatalDumpException;
import io.funcprops.dump.FuncPropsDumper;
import io.funcprops.ir.Function;
import io.funcprops.ir.PositionResolver;
import io.funcprops.output.ConsoleOutput;
import io.funcprops.props.FuncProps;
import io.funcprops.trace.TraceCategory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the func-props tool.
 */
@Command(
        name = "func-props",
        mixinStandardHelpOptions = true,
        version = "func-props 1.0.0",
        description = "Computes inlining-relevant properties of every method in compiled Java classes.",
        footer = {
                "",
                "Examples:",
                "  func-props target/classes",
                "  func-props app.jar --show-empty",
                "  func-props target/classes --dump props.dump --trace funcs,results"
        }
)
public class FuncPropsCli implements Callable<Integer> {

    static final int EXIT_USAGE = 1;
    static final int EXIT_FATAL = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(
            arity = "1..*",
            description = "Class directories, JAR files or class files to analyze"
    )
    private List<Path> inputs;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file"
    )
    private Path configFile;

    @Option(
            names = {"-d", "--dump"},
            description = "Write a function properties dump to this file instead of printing"
    )
    private Path dumpFile;

    @Option(
            names = {"-t", "--trace"},
            description = "Trace categories to write to stderr: funcs, func-flags, results",
            split = ","
    )
    private List<String> trace;

    @Option(
            names = {"--show-empty"},
            description = "Also print functions without any property"
    )
    private boolean showEmpty = false;

    @Override
    public Integer call() {
        AnalysisConfig config;
        try {
            config = loadConfig();
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error loading config: " + e.getMessage());
            return EXIT_USAGE;
        }

        List<Function> functions;
        try {
            BytecodeScanner scanner = new BytecodeScanner(config::isClassExcluded);
            functions = scanner.scan(inputs);
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        FuncPropsComputer computer = FuncPropsComputer.createDefault(
                new NodeBudgetEligibility(functions, config.getInlineBudget()), config.getTrace());

        if (config.unitTesting()) {
            return dump(config, computer, functions);
        }

        Map<Function, FuncProps> results = new IdentityHashMap<>();
        for (Function fn : functions) {
            results.put(fn, computer.compute(fn));
        }
        new ConsoleOutput(spec.commandLine().getOut())
                .showEmpty(showEmpty)
                .print(results);
        return 0;
    }

    private AnalysisConfig loadConfig() throws IOException {
        AnalysisConfig config;
        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            config = AnalysisConfig.load(configFile);
        } else {
            config = AnalysisConfig.defaults();
        }
        if (dumpFile != null) {
            config = config.withDumpFile(dumpFile);
        }
        if (trace != null) {
            Set<TraceCategory> categories = EnumSet.noneOf(TraceCategory.class);
            for (String name : trace) {
                categories.add(TraceCategory.fromName(name));
            }
            config = config.withTrace(categories);
        }
        return config;
    }

    private int dump(AnalysisConfig config, FuncPropsComputer computer, List<Function> functions) {
        DumpBuffer buffer = new DumpBuffer(computer, PositionResolver.basename(), config.getReservedPrefixes());
        FuncPropsDumper dumper = new FuncPropsDumper(buffer, config.getDumpFile());
        try {
            for (Function fn : functions) {
                dumper.dumpFuncProps(fn, config.getDumpFile());
            }
            int captured = buffer.size();
            dumper.dumpFuncProps(null, config.getDumpFile());
            System.err.println("Wrote " + captured + " function(s) to " + config.getDumpFile());
            return 0;
        } catch (FatalDumpException e) {
            System.err.println("Fatal: " + e.getMessage());
            return EXIT_FATAL;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FuncPropsCli()).execute(args);
        System.exit(exitCode);
    }
}
