package ai.condmatrix.analyzer;

import java.util.Objects;

/**
 * A function definition's location in a source file: 1-based, inclusive line numbers.
 */
public record FunctionRange(String name, int startLine, int endLine) {

    public FunctionRange {
        Objects.requireNonNull(name, "name cannot be null");
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, got " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    "endLine %d precedes startLine %d for %s".formatted(endLine, startLine, name));
        }
    }

    /** {@code name:start-end}, the form used in reports. */
    public String label() {
        return "%s:%d-%d".formatted(name, startLine, endLine);
    }
}
