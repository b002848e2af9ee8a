package io.funcprops.config;

import io.funcprops.dump.DumpBuffer;
import io.funcprops.trace.DebugTrace;
import io.funcprops.trace.TraceCategory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration loaded from a YAML file. Every key is optional.
 * <pre>
 * dumpFile: target/props.dump
 * trace: [funcs, func-flags, results]
 * reservedPrefixes: [".eq.", ".bridge."]
 * inlineBudget: 80
 * excludeClasses: [com.example.generated.]
 * </pre>
 */
public class AnalysisConfig {

    public static final int DEFAULT_INLINE_BUDGET = 80;

    private final Path dumpFile;
    private final Set<TraceCategory> trace;
    private final List<String> reservedPrefixes;
    private final int inlineBudget;
    private final List<String> excludeClasses;

    private AnalysisConfig(Path dumpFile,
                           Set<TraceCategory> trace,
                           List<String> reservedPrefixes,
                           int inlineBudget,
                           List<String> excludeClasses) {
        this.dumpFile = dumpFile;
        this.trace = trace;
        this.reservedPrefixes = reservedPrefixes;
        this.inlineBudget = inlineBudget;
        this.excludeClasses = excludeClasses;
    }

    /**
     * Configuration with no dump file, tracing taken from the environment and
     * default limits.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(null, DebugTrace.fromEnvironment(),
                DumpBuffer.DEFAULT_RESERVED_PREFIXES, DEFAULT_INLINE_BUDGET, List.of());
    }

    /**
     * Load configuration from a YAML file.
     */
    public static AnalysisConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Object loaded = yaml.load(in);
            if (!(loaded instanceof Map<?, ?> data)) {
                throw new IOException("Empty or invalid config file: " + configPath);
            }

            Object dumpValue = data.get("dumpFile");
            Path dumpFile = null;
            if (dumpValue instanceof String s && !s.isBlank()) {
                dumpFile = Path.of(s.trim());
            }

            Set<TraceCategory> trace = DebugTrace.fromEnvironment();
            if (data.containsKey("trace")) {
                trace = toTrace(data.get("trace"), configPath);
            }

            List<String> reservedPrefixes = DumpBuffer.DEFAULT_RESERVED_PREFIXES;
            if (data.containsKey("reservedPrefixes")) {
                reservedPrefixes = toList(data.get("reservedPrefixes"), "reservedPrefixes", configPath);
            }

            int inlineBudget = DEFAULT_INLINE_BUDGET;
            Object budgetValue = data.get("inlineBudget");
            if (budgetValue instanceof Number n) {
                inlineBudget = n.intValue();
            } else if (budgetValue != null) {
                throw new IOException("'inlineBudget' must be a number in " + configPath);
            }

            List<String> excludeClasses = toList(data.get("excludeClasses"), "excludeClasses", configPath);

            return new AnalysisConfig(dumpFile, trace, reservedPrefixes, inlineBudget, excludeClasses);
        }
    }

    private static Set<TraceCategory> toTrace(Object value, Path configPath) throws IOException {
        try {
            if (value == null) {
                return Set.of();
            }
            if (value instanceof Number n) {
                return DebugTrace.parse(String.valueOf(n.intValue()));
            }
            if (value instanceof List<?> list) {
                EnumSet<TraceCategory> result = EnumSet.noneOf(TraceCategory.class);
                for (Object item : list) {
                    if (item != null) {
                        result.add(TraceCategory.fromName(item.toString()));
                    }
                }
                return Collections.unmodifiableSet(result);
            }
            return DebugTrace.parse(value.toString());
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid 'trace' in " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static List<String> toList(Object value, String key, Path configPath) throws IOException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IOException("'" + key + "' must be a list in " + configPath);
        }
        return list.stream()
            .filter(item -> item != null && !item.toString().trim().isEmpty())
            .map(item -> item.toString().trim())
            .toList();
    }

    public AnalysisConfig withDumpFile(Path dumpFile) {
        return new AnalysisConfig(dumpFile, trace, reservedPrefixes, inlineBudget, excludeClasses);
    }

    public AnalysisConfig withTrace(Set<TraceCategory> trace) {
        return new AnalysisConfig(dumpFile, Set.copyOf(trace), reservedPrefixes, inlineBudget, excludeClasses);
    }

    /**
     * Dump file for unit-test capture, or null when not dumping.
     */
    public Path getDumpFile() {
        return dumpFile;
    }

    public Set<TraceCategory> getTrace() {
        return trace;
    }

    public List<String> getReservedPrefixes() {
        return reservedPrefixes;
    }

    public int getInlineBudget() {
        return inlineBudget;
    }

    public List<String> getExcludeClasses() {
        return excludeClasses;
    }

    /**
     * Check if a class FQN is excluded from scanning. Trailing dot means
     * prefix match, otherwise exact match.
     */
    public boolean isClassExcluded(String fqn) {
        for (String pattern : excludeClasses) {
            if (pattern.endsWith(".")) {
                if (fqn.startsWith(pattern)) {
                    return true;
                }
            } else if (fqn.equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if a properties dump was requested.
     */
    public boolean unitTesting() {
        return dumpFile != null;
    }
}
