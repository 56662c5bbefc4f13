package ai.condmatrix.analyzer;

import java.util.List;
import java.util.Objects;

/**
 * One arm of a conditional chain: the directive that opened it, its inclusive line span, and the chains nested
 * directly inside it.
 *
 * @param kind the opening directive
 * @param rawText the directive line as written, continuation lines joined
 * @param startLine line of the opening directive
 * @param endLine last line of the arm; the {@code #endif} line for the final arm
 * @param children chains lexically inside this arm, in source order
 * @param hasErrorDirective true if an {@code #error} appears directly in this arm (not inside a nested chain); such
 *     an arm is unreachable by the author's intent and takes no part in enumeration
 */
public record ConditionBranch(
        ConditionKind kind,
        String rawText,
        int startLine,
        int endLine,
        List<ConditionBlock> children,
        boolean hasErrorDirective) {

    public ConditionBranch {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(rawText, "rawText cannot be null");
        if (endLine < startLine - 1) {
            throw new IllegalArgumentException(
                    "Branch '%s' ends at %d before it starts at %d".formatted(rawText, endLine, startLine));
        }
        children = List.copyOf(children);
    }

    public boolean contains(int line) {
        return startLine <= line && line <= endLine;
    }

    public boolean isReachable() {
        return !hasErrorDirective;
    }
}
