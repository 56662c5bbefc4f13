package ai.condmatrix.analyzer;

import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Enumerates the configurations reachable through a forest of conditional chains.
 *
 * <p>Within one chain every reachable branch contributes its own configurations. A branch's own assignments are
 * crossed with every combination of its nested chains. Sibling chains are treated as independent: their assignments
 * are pooled and merged, not crossed, which keeps the matrix small at the cost of assuming siblings never
 * constrain one another.</p>
 */
public final class CombinationGenerator {
    private static final Logger logger = LogManager.getLogger(CombinationGenerator.class);

    private final ConditionTranslator translator;

    public CombinationGenerator(ConditionTranslator translator) {
        this.translator = translator;
    }

    public CombinationGenerator() {
        this(new ConditionTranslator());
    }

    /**
     * All configurations of one chain, one or more per reachable branch. A branch whose condition translates to
     * nothing and has no nested chains yields the empty combination.
     */
    public List<MacroCombination> expand(ConditionBlock block) {
        var result = new ArrayList<MacroCombination>();
        for (var branch : block.reachableBranches()) {
            var own = translator.translate(branch, block).assignments();

            List<List<MacroCombination>> childLists = new ArrayList<>();
            for (var child : branch.children()) {
                var expanded = expand(child);
                if (!expanded.isEmpty()) {
                    childLists.add(expanded);
                }
            }

            if (childLists.isEmpty()) {
                result.addAll(Combinations.split(own));
                continue;
            }
            for (var term : Lists.cartesianProduct(childLists)) {
                var raw = new ArrayList<>(own);
                for (var childCombination : term) {
                    raw.addAll(childCombination.assignments());
                }
                result.addAll(Combinations.split(raw));
            }
        }
        return result;
    }

    /**
     * All configurations of a forest of sibling chains.
     *
     * @return {@code []} for a forest with nothing to enumerate, the chain's own list for a single chain, otherwise
     *     the merged pool of every sibling's assignments
     */
    public List<MacroCombination> expandForest(List<ConditionBlock> blocks) {
        List<List<MacroCombination>> perBlock = new ArrayList<>();
        for (var block : blocks) {
            var expanded = expand(block);
            if (!expanded.isEmpty()) {
                perBlock.add(expanded);
            }
        }
        if (perBlock.isEmpty()) {
            return List.of();
        }
        if (perBlock.size() == 1) {
            return perBlock.get(0);
        }

        var pool = new ArrayList<MacroAssignment>();
        for (var combinations : perBlock) {
            for (var combination : combinations) {
                for (var assignment : combination.assignments()) {
                    pool.add(MacroNameRules.normalizeOrder(assignment));
                }
            }
        }
        var merged = Combinations.distinct(Combinations.mergeConflicts(pool));
        logger.debug("Merged {} sibling chains into {} combinations", perBlock.size(), merged.size());
        return merged;
    }
}
