package ai.condmatrix.analyzer;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Computes the configurations under which one function can be compiled.
 *
 * <p>The function's configurations are the chain of conditions enclosing its first line (the external path)
 * combined with every configuration of the conditional chains inside its body. The result is repaired for
 * reversed operands, stripped of anything that cannot be passed to a compiler, and de-duplicated. A function
 * enclosed by {@code #if 0} has no configurations at all, which callers report as statically disabled.</p>
 */
public final class FunctionMacroAnalyzer {
    private static final Logger logger = LogManager.getLogger(FunctionMacroAnalyzer.class);

    private final ConditionTreeParser parser;
    private final PathLocator locator;
    private final CombinationGenerator generator;
    private final boolean repairMacroOrder;

    public FunctionMacroAnalyzer(
            ConditionTreeParser parser, PathLocator locator, CombinationGenerator generator, boolean repairMacroOrder) {
        this.parser = parser;
        this.locator = locator;
        this.generator = generator;
        this.repairMacroOrder = repairMacroOrder;
    }

    public FunctionMacroAnalyzer(boolean repairMacroOrder) {
        this(new ConditionTreeParser(), new PathLocator(), new CombinationGenerator(), repairMacroOrder);
    }

    public FunctionMacroAnalyzer() {
        this(true);
    }

    /** Parses the conditional structure of the whole file. */
    public List<ConditionBlock> parseFile(List<String> fileLines) {
        return parser.parse(fileLines, 1);
    }

    public List<MacroCombination> analyze(List<String> fileLines, FunctionRange range) {
        return analyze(fileLines, parseFile(fileLines), range);
    }

    /**
     * Same as {@link #analyze(List, FunctionRange)}, reusing a forest already built by {@link #parseFile} so that
     * many functions of one file share a single parse.
     */
    public List<MacroCombination> analyze(List<String> fileLines, List<ConditionBlock> fileForest, FunctionRange range) {
        var result = new ArrayList<MacroCombination>();
        for (var combination : enumerate(fileLines, fileForest, range)) {
            result.add(combination.retain(MacroNameRules::isCompilable));
        }
        var distinct = Combinations.distinct(result);
        logger.debug("{}: {} combination(s)", range.label(), distinct.size());
        return distinct;
    }

    /**
     * The order-repaired combinations before filtering: undefined markers and malformed names are still present.
     */
    @VisibleForTesting
    List<MacroCombination> enumerate(List<String> fileLines, List<ConditionBlock> fileForest, FunctionRange range) {
        if (range.startLine() > fileLines.size()) {
            logger.warn("{} lies outside a file of {} lines", range.label(), fileLines.size());
            return List.of();
        }

        var external = locator.locate(fileForest, range.startLine());
        if (external.contains(MacroAssignment.STATICALLY_FALSE)) {
            logger.debug("{} is inside a statically disabled region", range.label());
            return List.of();
        }

        int end = Math.min(range.endLine(), fileLines.size());
        var body = fileLines.subList(range.startLine() - 1, end);
        var internal = generator.expandForest(parser.parse(body, range.startLine()));

        var combinations = new ArrayList<MacroCombination>();
        if (internal.isEmpty()) {
            combinations.addAll(Combinations.split(external));
        } else {
            for (var inner : internal) {
                var raw = new ArrayList<>(external);
                raw.addAll(inner.assignments());
                combinations.addAll(Combinations.split(raw));
            }
        }
        return repairMacroOrder ? repairOrder(combinations) : combinations;
    }

    private static List<MacroCombination> repairOrder(List<MacroCombination> combinations) {
        var repaired = new ArrayList<MacroCombination>();
        for (var combination : combinations) {
            var normalized = combination.map(MacroNameRules::normalizeOrder);
            if (normalized.isPresent()) {
                repaired.add(normalized.get());
                continue;
            }
            // repairing made two names collide; split them like any other conflict
            var swapped = combination.assignments().stream()
                    .map(MacroNameRules::normalizeOrder)
                    .toList();
            repaired.addAll(Combinations.split(swapped));
        }
        return repaired;
    }
}
