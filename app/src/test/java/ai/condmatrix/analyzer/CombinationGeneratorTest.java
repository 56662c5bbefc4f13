package ai.condmatrix.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class CombinationGeneratorTest {

    private final ConditionTreeParser parser = new ConditionTreeParser();
    private final CombinationGenerator generator = new CombinationGenerator();

    private List<ConditionBlock> forest(String... lines) {
        return parser.parse(Arrays.asList(lines), 1);
    }

    private static List<List<String>> strings(List<MacroCombination> combinations) {
        return combinations.stream().map(MacroCombination::toStrings).toList();
    }

    @Test
    void expand_IfdefElse_OneCombinationPerBranch() {
        var block = forest("#ifdef FOO", "#else", "#endif").get(0);
        assertEquals(List.of(List.of("FOO=1"), List.of("FOO=**remove**")), strings(generator.expand(block)));
    }

    @Test
    void expand_NestedBlock_PrefixesOuterAssignments() {
        var block = forest("#ifdef A", "#ifdef B", "#else", "#endif", "#endif").get(0);
        assertEquals(
                List.of(List.of("A=1", "B=1"), List.of("A=1", "B=**remove**")),
                strings(generator.expand(block)));
    }

    @Test
    void expand_TwoNestedBlocks_CrossesTheirCombinations() {
        var block = forest(
                        "#if A",
                        "#if X == 1", "#elif X == 2", "#endif",
                        "#ifdef Y", "#endif",
                        "#endif")
                .get(0);
        assertEquals(
                List.of(List.of("A=1", "X=1", "Y=1"), List.of("A=1", "X=2", "Y=1")),
                strings(generator.expand(block)));
    }

    @Test
    void expand_UntranslatableBranchWithoutChildren_YieldsEmptyCombination() {
        var block = forest("#if foo(1)", "#endif").get(0);
        assertEquals(List.of(MacroCombination.empty()), generator.expand(block));
    }

    @Test
    void expand_NestedRedefinition_SplitsIntoSiblings() {
        var block = forest("#if X == 1", "#if X == 2", "#endif", "#endif").get(0);
        assertEquals(List.of(List.of("X=1"), List.of("X=2")), strings(generator.expand(block)));
    }

    @Test
    void expand_SkipsErrorBranches() {
        var block = forest("#ifdef A", "#else", "#error unsupported", "#endif").get(0);
        assertEquals(List.of(List.of("A=1")), strings(generator.expand(block)));
    }

    @Test
    void expandForest_Empty_ReturnsNothing() {
        assertEquals(List.of(), generator.expandForest(List.of()));
    }

    @Test
    void expandForest_SingleBlock_ReturnsItsCombinations() {
        var blocks = forest("#if MODE == 1", "#elif MODE == 2", "#endif");
        assertEquals(List.of(List.of("MODE=1"), List.of("MODE=2")), strings(generator.expandForest(blocks)));
    }

    @Test
    void expandForest_Siblings_SharesSingleValuedAndCrossesConflicts() {
        var blocks = forest("#ifdef A", "#endif", "#if B == 1", "#endif", "#if B == 2", "#endif");
        assertEquals(
                List.of(List.of("A=1", "B=1"), List.of("A=1", "B=2")),
                strings(generator.expandForest(blocks)));
    }

    @Test
    void expandForest_Siblings_RepairsReversedAssignmentsBeforeMerging() {
        var blocks = forest("#if 1 == FOO", "#endif", "#ifdef BAR", "#endif");
        assertEquals(List.of(List.of("FOO=1", "BAR=1")), strings(generator.expandForest(blocks)));
    }

    @Test
    void expandForest_SiblingsWithNothingToAssign_ReturnsNothing() {
        var blocks = forest("#if foo(1)", "#endif", "#if 1", "#endif");
        assertEquals(List.of(), generator.expandForest(blocks));
    }
}
