package ai.condmatrix.analyzer;

/**
 * Removes comments from C source text.
 *
 * <p>Implementations must preserve line count and line numbering exactly: every directive and function range is
 * addressed by 1-based line number, and a stripper that merges or drops lines silently misattributes them.</p>
 */
@FunctionalInterface
public interface CommentStripper {

    CommentStripper NONE = source -> source;

    String strip(String source);
}
