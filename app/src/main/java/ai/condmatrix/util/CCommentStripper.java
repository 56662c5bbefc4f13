package ai.condmatrix.util;

import ai.condmatrix.analyzer.CommentStripper;

/**
 * Blanks C and C++ comments with spaces, leaving newlines (and therefore line numbers) intact. String and character
 * literals are copied verbatim, so {@code "/*"} inside a literal does not start a comment.
 */
public final class CCommentStripper implements CommentStripper {

    private enum State {
        CODE,
        LINE_COMMENT,
        BLOCK_COMMENT,
        STRING,
        CHAR
    }

    @Override
    public String strip(String source) {
        var out = new StringBuilder(source.length());
        var state = State.CODE;
        int n = source.length();

        for (int i = 0; i < n; i++) {
            char c = source.charAt(i);
            char next = i + 1 < n ? source.charAt(i + 1) : '\0';

            switch (state) {
                case CODE -> {
                    if (c == '/' && next == '/') {
                        state = State.LINE_COMMENT;
                        out.append("  ");
                        i++;
                    } else if (c == '/' && next == '*') {
                        state = State.BLOCK_COMMENT;
                        out.append("  ");
                        i++;
                    } else {
                        if (c == '"') {
                            state = State.STRING;
                        } else if (c == '\'') {
                            state = State.CHAR;
                        }
                        out.append(c);
                    }
                }
                case LINE_COMMENT -> {
                    if (c == '\n') {
                        state = State.CODE;
                        out.append(c);
                    } else {
                        out.append(blank(c));
                    }
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        state = State.CODE;
                        out.append("  ");
                        i++;
                    } else {
                        out.append(blank(c));
                    }
                }
                case STRING, CHAR -> {
                    out.append(c);
                    char quote = state == State.STRING ? '"' : '\'';
                    if (c == '\\' && i + 1 < n) {
                        out.append(next);
                        i++;
                    } else if (c == quote || c == '\n') {
                        // an unterminated literal ends at the line break
                        state = State.CODE;
                    }
                }
            }
        }
        return out.toString();
    }

    private static char blank(char c) {
        return c == '\n' || c == '\r' ? c : ' ';
    }
}
