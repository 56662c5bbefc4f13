package ai.condmatrix.analyzer;

import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns raw assignment sequences, which may name a macro more than once, into name-unique combinations.
 */
final class Combinations {
    private static final Logger logger = LogManager.getLogger(Combinations.class);

    /** Largest cross product that is expanded in full. */
    static final int MAX_COMBINATIONS = 1 << 16;

    private Combinations() {}

    /**
     * Completes one raw sequence. Repeats of the same assignment collapse; a macro given different values becomes
     * one sibling combination per value, crossed with every other conflicting macro in first-seen order.
     *
     * <p>When the full cross product would exceed {@link #MAX_COMBINATIONS} rows, the result degrades to one row per
     * value position: row {@code i} takes each macro's {@code i}-th value, or its last one if it has fewer. Every value
     * still appears in some row.</p>
     *
     * @return at least one combination; the empty sequence gives the single empty combination
     */
    static List<MacroCombination> split(List<MacroAssignment> assignments) {
        if (assignments.isEmpty()) {
            return List.of(MacroCombination.empty());
        }
        Map<String, Set<MacroAssignment>> byName = new LinkedHashMap<>();
        for (var assignment : assignments) {
            byName.computeIfAbsent(assignment.name(), k -> new LinkedHashSet<>()).add(assignment);
        }

        var choices = byName.values().stream()
                .map(values -> (List<MacroAssignment>) List.copyOf(values))
                .toList();
        long size = productSize(choices);
        if (size > MAX_COMBINATIONS) {
            logger.warn(
                    "{} conflicting macro(s) would give {} combinations; keeping one row per value instead",
                    choices.stream().filter(c -> c.size() > 1).count(),
                    size == Long.MAX_VALUE ? "too many" : size);
            return aligned(choices);
        }
        var result = new ArrayList<MacroCombination>();
        for (var term : Lists.cartesianProduct(choices)) {
            result.add(new MacroCombination(term));
        }
        return result;
    }

    private static long productSize(List<List<MacroAssignment>> choices) {
        long size = 1;
        for (var values : choices) {
            if (size > Long.MAX_VALUE / values.size()) {
                return Long.MAX_VALUE;
            }
            size *= values.size();
        }
        return size;
    }

    private static List<MacroCombination> aligned(List<List<MacroAssignment>> choices) {
        int rows = choices.stream().mapToInt(List::size).max().orElse(1);
        var result = new ArrayList<MacroCombination>(rows);
        for (int i = 0; i < rows; i++) {
            var row = new ArrayList<MacroAssignment>(choices.size());
            for (var values : choices) {
                row.add(values.get(Math.min(i, values.size() - 1)));
            }
            result.add(new MacroCombination(row));
        }
        return result;
    }

    /**
     * Merges a pool of assignments gathered from independent sources (sibling blocks, or every function of a file)
     * into the smallest set of combinations covering every value seen. An empty pool gives no combinations.
     */
    static List<MacroCombination> mergeConflicts(List<MacroAssignment> pool) {
        return pool.isEmpty() ? List.of() : split(pool);
    }

    /** Removes combinations with the same assignment set as an earlier one, keeping the first. */
    static List<MacroCombination> distinct(List<MacroCombination> combinations) {
        var seen = new LinkedHashMap<Set<String>, MacroCombination>();
        for (var combination : combinations) {
            seen.putIfAbsent(combination.canonicalKey(), combination);
        }
        return List.copyOf(seen.values());
    }
}
