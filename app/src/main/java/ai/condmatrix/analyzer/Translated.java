package ai.condmatrix.analyzer;

import java.util.List;

/**
 * The outcome of translating one branch condition.
 * <p>
 * {@link None} means the condition could not be represented (a function call, a bare number, an {@code #else} with no
 * recoverable governing macro); the branch still contributes its nested chains. {@link Single} is one assignment,
 * {@link Many} the conjunction produced by {@code &&}.
 */
public sealed interface Translated {

    static Translated none() {
        return None.INSTANCE;
    }

    static Translated of(MacroAssignment assignment) {
        return new Single(assignment);
    }

    static Translated of(List<MacroAssignment> assignments) {
        return switch (assignments.size()) {
            case 0 -> none();
            case 1 -> new Single(assignments.get(0));
            default -> new Many(assignments);
        };
    }

    final class None implements Translated {
        static final None INSTANCE = new None();

        private None() {}

        @Override
        public List<MacroAssignment> assignments() {
            return List.of();
        }

        @Override
        public String toString() {
            return "Translated.None";
        }
    }

    record Single(MacroAssignment assignment) implements Translated {
        @Override
        public List<MacroAssignment> assignments() {
            return List.of(assignment);
        }
    }

    record Many(List<MacroAssignment> assignments) implements Translated {
        public Many {
            assignments = List.copyOf(assignments);
        }
    }

    /** The assignments this condition requires, in source order. */
    List<MacroAssignment> assignments();

    default boolean isEmpty() {
        return assignments().isEmpty();
    }
}
