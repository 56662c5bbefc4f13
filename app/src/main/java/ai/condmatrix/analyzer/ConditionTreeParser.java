package ai.condmatrix.analyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the forest of conditional-compilation chains found in a run of source lines.
 *
 * <p>The scan is a single pass with an explicit stack of open chains. A chain only becomes a {@link ConditionBlock}
 * once its {@code #endif} is seen; chains still open at the end of input are dropped together with everything nested
 * in them, and stray {@code #elif}/{@code #else}/{@code #endif} lines are ignored. Malformed directive structure
 * therefore yields less structure, never an error.</p>
 */
public final class ConditionTreeParser {
    private static final Logger logger = LogManager.getLogger(ConditionTreeParser.class);

    /**
     * Parses {@code lines}, numbering them from {@code firstLineNumber}.
     *
     * @param lines source lines, ideally with comments already blanked
     * @param firstLineNumber the 1-based line number of {@code lines.get(0)}; pass a function's start line to parse
     *     its body with file-relative numbering
     * @return the top-level chains in source order
     */
    public List<ConditionBlock> parse(List<String> lines, int firstLineNumber) {
        var directives = normalizeDirectives(lines);
        List<ConditionBlock> forest = new ArrayList<>();
        Deque<OpenBlock> stack = new ArrayDeque<>();

        for (int i = 0; i < directives.length; i++) {
            var directive = directives[i];
            if (directive == null) {
                continue;
            }
            int lineNumber = firstLineNumber + i;

            if (directive.startsWith("#endif")) {
                var open = stack.poll();
                if (open == null) {
                    logger.debug("Ignoring unmatched #endif at line {}", lineNumber);
                    continue;
                }
                open.closeCurrent(lineNumber, i - 1, directives);
                var block = new ConditionBlock(open.branches, open.startLine, lineNumber);
                var parent = stack.peek();
                if (parent == null) {
                    forest.add(block);
                } else {
                    parent.current.children.add(block);
                }
                continue;
            }

            var kind = ConditionKind.ofDirective(directive).orElse(null);
            if (kind == null) {
                continue;
            }

            if (kind.opensBlock()) {
                stack.push(new OpenBlock(new OpenBranch(kind, directive, lineNumber, i)));
            } else {
                var open = stack.peek();
                if (open == null) {
                    logger.debug("Ignoring {} outside any conditional at line {}", kind.directive(), lineNumber);
                    continue;
                }
                open.closeCurrent(lineNumber - 1, i - 1, directives);
                open.current = new OpenBranch(kind, directive, lineNumber, i);
            }
        }

        if (!stack.isEmpty()) {
            logger.debug(
                    "Dropping {} unterminated conditional block(s); outermost opened at line {}",
                    stack.size(),
                    stack.peekLast().startLine);
        }
        return List.copyOf(forest);
    }

    /**
     * Maps every line to its normalized directive text, or null for ordinary lines. Backslash-continued directives
     * are joined onto their first line and the continuation lines are mapped to null.
     */
    private static String[] normalizeDirectives(List<String> lines) {
        var result = new String[lines.size()];
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i).strip();
            if (!line.startsWith("#")) {
                continue;
            }
            int first = i;
            var text = new StringBuilder("#").append(line.substring(1).stripLeading());
            while (endsWithContinuation(text)) {
                text.setLength(text.length() - 1);
                while (text.length() > 0 && Character.isWhitespace(text.charAt(text.length() - 1))) {
                    text.setLength(text.length() - 1);
                }
                if (i + 1 >= lines.size()) {
                    break;
                }
                text.append(' ').append(lines.get(++i).strip());
            }
            result[first] = text.toString().strip();
        }
        return result;
    }

    private static boolean endsWithContinuation(CharSequence text) {
        return text.length() > 0 && text.charAt(text.length() - 1) == '\\';
    }

    /**
     * True if an {@code #error} appears at the branch's own nesting level between {@code fromIndex} (the branch's
     * opening directive, which is skipped) and {@code toIndex} inclusive.
     */
    private static boolean containsErrorDirective(String[] directives, int fromIndex, int toIndex) {
        int depth = 0;
        for (int i = fromIndex + 1; i <= toIndex && i < directives.length; i++) {
            var directive = directives[i];
            if (directive == null) {
                continue;
            }
            if (directive.startsWith("#if")) {
                depth++;
            } else if (directive.startsWith("#endif")) {
                depth--;
            } else if (depth == 0 && directive.startsWith("#error")) {
                return true;
            }
        }
        return false;
    }

    private static final class OpenBranch {
        final ConditionKind kind;
        final String rawText;
        final int startLine;
        final int startIndex;
        final List<ConditionBlock> children = new ArrayList<>();

        OpenBranch(ConditionKind kind, String rawText, int startLine, int startIndex) {
            this.kind = kind;
            this.rawText = rawText;
            this.startLine = startLine;
            this.startIndex = startIndex;
        }
    }

    private static final class OpenBlock {
        final int startLine;
        final List<ConditionBranch> branches = new ArrayList<>();
        OpenBranch current;

        OpenBlock(OpenBranch first) {
            this.startLine = first.startLine;
            this.current = first;
        }

        void closeCurrent(int endLine, int lastContentIndex, String[] directives) {
            boolean hasError = containsErrorDirective(directives, current.startIndex, lastContentIndex);
            if (hasError) {
                logger.debug("Branch '{}' at line {} contains #error; excluded", current.rawText, current.startLine);
            }
            branches.add(new ConditionBranch(
                    current.kind, current.rawText, current.startLine, endLine, current.children, hasError));
        }
    }
}
