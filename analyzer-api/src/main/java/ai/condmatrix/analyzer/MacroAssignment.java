package ai.condmatrix.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * One symbolic macro constraint, {@code NAME=VALUE}.
 *
 * <p>The name is whatever the condition translator recovered from the directive text; it is not validated here
 * because order normalization and filtering need to see (and repair or discard) malformed names. Equality is by
 * name and serialized value.</p>
 */
public record MacroAssignment(String name, AssignmentValue value) {

    /**
     * The "statically false" path marker, {@code 0=1}. A function whose enclosing directive chain contains it sits
     * in a permanently disabled region (typically {@code #if 0}) and has nothing to test.
     */
    public static final MacroAssignment STATICALLY_FALSE = new MacroAssignment("0", AssignmentValue.of("1"));

    public MacroAssignment {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Macro name must not be blank");
        }
        name = name.strip();
    }

    public static MacroAssignment of(String name, String value) {
        return new MacroAssignment(name, AssignmentValue.of(value));
    }

    public static MacroAssignment of(String name, long value) {
        return of(name, Long.toString(value));
    }

    public static MacroAssignment undefined(String name) {
        return new MacroAssignment(name, AssignmentValue.undefined());
    }

    /**
     * Parses the {@code NAME=VALUE} form. The first '=' separates name from value.
     *
     * @throws IllegalArgumentException if the text has no '=' or either side is blank
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MacroAssignment parse(String text) {
        int eq = text.indexOf('=');
        if (eq <= 0 || eq == text.length() - 1) {
            throw new IllegalArgumentException("Expected NAME=VALUE, got '%s'".formatted(text));
        }
        return new MacroAssignment(text.substring(0, eq), AssignmentValue.parse(text.substring(eq + 1).strip()));
    }

    /** The same constraint with name and value exchanged; used to repair reversed operands. */
    public MacroAssignment swapped() {
        return MacroAssignment.of(value.text(), name);
    }

    /** Formats this assignment as a compiler define, {@code -DNAME=VALUE}. */
    public String toCompilerFlag() {
        return "-D" + this;
    }

    @JsonValue
    @Override
    public String toString() {
        return name + "=" + value.text();
    }
}
