package io.funcprops.output;

import io.funcprops.ir.Function;
import io.funcprops.props.FuncProps;

import java.io.PrintWriter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Prints computed function properties to the console in a simple format.
 */
public class ConsoleOutput {

    private static final Comparator<Function> ORDER = Comparator
            .comparing((Function f) -> String.valueOf(f.file()))
            .thenComparingInt(Function::line)
            .thenComparing(Function::name);

    private final PrintWriter out;
    private boolean showEmpty = false;

    public ConsoleOutput(PrintWriter out) {
        this.out = out;
    }

    public ConsoleOutput showEmpty(boolean show) {
        this.showEmpty = show;
        return this;
    }

    /**
     * Prints one section per function, ordered by file, line and name.
     *
     * @return the number of functions printed
     */
    public int print(Map<Function, FuncProps> results) {
        List<Function> sorted = results.keySet().stream()
                .sorted(ORDER)
                .toList();

        int printed = 0;
        for (Function fn : sorted) {
            String rendered = results.get(fn).toString("  ");
            if (rendered.isEmpty() && !showEmpty) {
                continue;
            }
            out.println(fn.name() + " (" + fn.file() + ":" + fn.line() + ")");
            out.print(rendered.isEmpty() ? "  (no properties)\n" : rendered);
            printed++;
        }
        out.flush();
        return printed;
    }
}
