package ai.condmatrix.analyzer;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges every function's configurations into one build matrix for the whole file.
 *
 * <p>All assignments are pooled. A macro that only ever takes one value is shared by every row; macros seen with
 * several values are crossed. The matrix is what a test build of the file has to cover.</p>
 */
public final class FileLevelAggregator {

    public List<MacroCombination> aggregate(List<List<MacroCombination>> perFunction) {
        var pool = new ArrayList<MacroAssignment>();
        for (var combinations : perFunction) {
            for (var combination : combinations) {
                for (var assignment : combination.assignments()) {
                    if (MacroNameRules.isIdentifier(assignment.name())) {
                        pool.add(assignment);
                    }
                }
            }
        }

        var matrix = new ArrayList<MacroCombination>();
        for (var combination : Combinations.mergeConflicts(pool)) {
            matrix.add(combination.retain(a -> !a.value().isSentinel()));
        }
        return Combinations.distinct(matrix);
    }
}
