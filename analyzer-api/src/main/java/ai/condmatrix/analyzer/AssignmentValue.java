package ai.condmatrix.analyzer;

import java.util.Objects;

/**
 * The right-hand side of a {@link MacroAssignment}.
 * <p>
 * A value is either a literal that can be passed to the compiler as {@code -DNAME=VALUE}, or the
 * {@link Undefined} marker meaning "this macro must not be defined on this path". The marker cannot be expressed
 * as a compiler flag; it serializes as {@code **remove**} so downstream consumers that still speak the string
 * format keep working, and the final filtering stage drops it.
 * <p>
 * Use {@link #of(String)} for literal text and {@link #undefined()} for the marker.
 */
public sealed interface AssignmentValue {

    /** Serialized form of {@link Undefined}. */
    String UNDEFINED_TEXT = "**remove**";

    /**
     * Marker embedded in every sentinel value. Any value whose text contains it is not a real compiler value.
     */
    String SENTINEL_MARKER = "**";

    /**
     * Factory method for the "macro must be absent" marker.
     */
    static AssignmentValue undefined() {
        return Undefined.INSTANCE;
    }

    /**
     * Factory method for a literal value.
     *
     * @param text the literal text, e.g. "1", "STD_ON"
     * @throws IllegalArgumentException if text is blank
     */
    static AssignmentValue of(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Literal value must not be blank");
        }
        return new Literal(text.strip());
    }

    /**
     * Parses the serialized form produced by {@link #text()}.
     */
    static AssignmentValue parse(String text) {
        return UNDEFINED_TEXT.equals(text) ? undefined() : of(text);
    }

    /**
     * Singleton representing an undefined macro.
     */
    final class Undefined implements AssignmentValue {
        static final Undefined INSTANCE = new Undefined();

        private Undefined() {
            // use AssignmentValue.undefined()
        }

        @Override
        public String text() {
            return UNDEFINED_TEXT;
        }

        @Override
        public String toString() {
            return UNDEFINED_TEXT;
        }
    }

    /**
     * A literal value as written (or derived) from a directive.
     */
    record Literal(String value) implements AssignmentValue {
        @Override
        public String text() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /** The serialized text of this value. */
    String text();

    /**
     * True if this value is a placeholder that must be stripped before the combination is compiled.
     */
    default boolean isSentinel() {
        return text().contains(SENTINEL_MARKER);
    }
}
