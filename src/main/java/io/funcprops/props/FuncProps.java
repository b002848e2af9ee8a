package io.funcprops.props;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Properties of one function, merged from all analyzers.
 * <p>
 * Sets are normalized to enum declaration order so the rendering and the JSON
 * encoding are deterministic.
 *
 * @param flags       Function-level flags
 * @param paramFlags  One flag set per declared parameter
 * @param resultFlags One flag set per result
 */
@JsonPropertyOrder({"flags", "paramFlags", "resultFlags"})
public record FuncProps(
        Set<FuncPropBits> flags,
        List<Set<ParamPropBits>> paramFlags,
        List<Set<ResultPropBits>> resultFlags
) {
    public FuncProps {
        flags = ordered(FuncPropBits.class, flags);
        paramFlags = orderedAll(ParamPropBits.class, paramFlags);
        resultFlags = orderedAll(ResultPropBits.class, resultFlags);
    }

    public static FuncProps empty() {
        return new FuncProps(Set.of(), List.of(), List.of());
    }

    public boolean hasFlag(FuncPropBits bit) {
        return flags.contains(bit);
    }

    /**
     * Renders the properties one per line, each line starting with
     * {@code prefix}. Flag lists with no flag set at all are omitted, so a
     * function without properties renders as the empty string.
     */
    public String toString(String prefix) {
        StringBuilder sb = new StringBuilder();
        if (!flags.isEmpty()) {
            sb.append(prefix).append("Flags ").append(describe(flags)).append('\n');
        }
        appendFlagList(sb, paramFlags, prefix, "ParamFlags");
        appendFlagList(sb, resultFlags, prefix, "ResultFlags");
        return sb.toString();
    }

    @Override
    public String toString() {
        return toString("");
    }

    private static <E extends Enum<E> & PropBit> void appendFlagList(
            StringBuilder sb, List<Set<E>> list, String prefix, String tag) {
        boolean anySet = list.stream().anyMatch(s -> !s.isEmpty());
        if (!anySet) {
            return;
        }
        sb.append(prefix).append(tag).append('\n');
        for (int i = 0; i < list.size(); i++) {
            sb.append(prefix).append("  ").append(i).append(' ')
                    .append(describe(list.get(i))).append('\n');
        }
    }

    /**
     * Joins display names with '|', or "0" for an empty set.
     */
    static String describe(Set<? extends PropBit> bits) {
        if (bits.isEmpty()) {
            return "0";
        }
        return bits.stream().map(PropBit::displayName).collect(Collectors.joining("|"));
    }

    private static <E extends Enum<E>> Set<E> ordered(Class<E> type, Collection<E> bits) {
        EnumSet<E> set = EnumSet.noneOf(type);
        if (bits != null) {
            set.addAll(bits);
        }
        return Collections.unmodifiableSet(set);
    }

    private static <E extends Enum<E>> List<Set<E>> orderedAll(Class<E> type, List<? extends Collection<E>> sets) {
        if (sets == null) {
            return List.of();
        }
        List<Set<E>> result = new ArrayList<>(sets.size());
        for (Collection<E> s : sets) {
            result.add(ordered(type, s));
        }
        return Collections.unmodifiableList(result);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator analyzers merge their findings into.
     */
    public static class Builder {
        private final EnumSet<FuncPropBits> flags = EnumSet.noneOf(FuncPropBits.class);
        private List<Set<ParamPropBits>> paramFlags = List.of();
        private List<Set<ResultPropBits>> resultFlags = List.of();

        public Builder flag(FuncPropBits bit) {
            flags.add(bit);
            return this;
        }

        public Builder paramFlags(List<Set<ParamPropBits>> paramFlags) {
            this.paramFlags = paramFlags;
            return this;
        }

        public Builder resultFlags(List<Set<ResultPropBits>> resultFlags) {
            this.resultFlags = resultFlags;
            return this;
        }

        public Set<FuncPropBits> flags() {
            return Collections.unmodifiableSet(flags);
        }

        public FuncProps build() {
            return new FuncProps(flags, paramFlags, resultFlags);
        }
    }
}
