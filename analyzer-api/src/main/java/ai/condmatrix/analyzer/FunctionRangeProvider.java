package ai.condmatrix.analyzer;

import java.util.List;

/** Implemented by components that can find function definitions in C source lines. */
public interface FunctionRangeProvider {

    /**
     * Finds every function definition in {@code lines}, in source order.
     *
     * @param lines comment-stripped source lines; line {@code i} of the list is source line {@code i + 1}
     */
    List<FunctionRange> findFunctions(List<String> lines);

    /**
     * Gets every definition of the named function. A file may define the same name more than once under mutually
     * exclusive preprocessor branches, so more than one range can match. If none match, returns an empty list.
     */
    default List<FunctionRange> findFunction(List<String> lines, String name) {
        return findFunctions(lines).stream()
                .filter(range -> range.name().equals(name))
                .toList();
    }
}
