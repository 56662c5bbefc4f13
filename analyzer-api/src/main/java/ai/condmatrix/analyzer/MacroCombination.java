package ai.condmatrix.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * One buildable configuration: an ordered set of macro assignments in which every macro name appears at most once.
 *
 * <p>Instances are immutable. Transformations ({@link #map}, {@link #retain}) return new combinations. Callers that
 * hold a raw assignment sequence that may repeat a name must resolve the conflict first (the engine splits such
 * sequences into sibling combinations); this constructor only enforces the invariant.</p>
 */
public final class MacroCombination {
    private static final MacroCombination EMPTY = new MacroCombination(List.of());

    private final List<MacroAssignment> assignments;

    /**
     * @throws IllegalArgumentException if two assignments share a name
     */
    public MacroCombination(List<MacroAssignment> assignments) {
        var copy = List.copyOf(assignments);
        Set<String> names = new HashSet<>();
        for (var assignment : copy) {
            if (!names.add(assignment.name())) {
                throw new IllegalArgumentException(
                        "Macro %s assigned more than once in %s".formatted(assignment.name(), copy));
            }
        }
        this.assignments = copy;
    }

    public static MacroCombination empty() {
        return EMPTY;
    }

    public static MacroCombination of(MacroAssignment... assignments) {
        return new MacroCombination(List.of(assignments));
    }

    /**
     * Builds a combination from serialized {@code NAME=VALUE} strings.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MacroCombination parse(List<String> serialized) {
        return new MacroCombination(
                serialized.stream().map(MacroAssignment::parse).toList());
    }

    public List<MacroAssignment> assignments() {
        return assignments;
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    public int size() {
        return assignments.size();
    }

    public Optional<MacroAssignment> get(String name) {
        return assignments.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    public boolean contains(MacroAssignment assignment) {
        return assignments.contains(assignment);
    }

    /**
     * Applies {@code mapper} to every assignment. Returns empty if the mapping made two names collide, so the
     * caller can decide how to resolve the conflict.
     */
    public Optional<MacroCombination> map(UnaryOperator<MacroAssignment> mapper) {
        var mapped = assignments.stream().map(mapper).toList();
        var distinctNames = mapped.stream().map(MacroAssignment::name).distinct().count();
        return distinctNames == mapped.size() ? Optional.of(new MacroCombination(mapped)) : Optional.empty();
    }

    /** Keeps only the assignments accepted by {@code keep}. */
    public MacroCombination retain(Predicate<MacroAssignment> keep) {
        var kept = new ArrayList<MacroAssignment>(assignments.size());
        for (var assignment : assignments) {
            if (keep.test(assignment)) {
                kept.add(assignment);
            }
        }
        return kept.size() == assignments.size() ? this : new MacroCombination(kept);
    }

    /**
     * Order-insensitive identity, used to de-duplicate combinations that differ only in assignment order.
     */
    public Set<String> canonicalKey() {
        return assignments.stream().map(MacroAssignment::toString).collect(Collectors.toCollection(TreeSet::new));
    }

    /** Serialized form: the ordered {@code NAME=VALUE} strings. */
    @JsonValue
    public List<String> toStrings() {
        return assignments.stream().map(MacroAssignment::toString).toList();
    }

    /** The combination as {@code -DNAME=VALUE} compiler flags. */
    public List<String> toCompilerFlags() {
        return assignments.stream().map(MacroAssignment::toCompilerFlag).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MacroCombination other)) return false;
        return assignments.equals(other.assignments);
    }

    @Override
    public int hashCode() {
        return assignments.hashCode();
    }

    @Override
    public String toString() {
        return toStrings().toString();
    }
}
