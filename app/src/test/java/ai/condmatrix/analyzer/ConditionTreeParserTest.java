package ai.condmatrix.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConditionTreeParserTest {

    private final ConditionTreeParser parser = new ConditionTreeParser();

    @Test
    void parse_IfdefElse_BuildsOneBlockWithTwoBranches() {
        var forest = parser.parse(List.of("#ifdef FOO", "int a;", "#else", "int b;", "#endif"), 1);

        assertEquals(1, forest.size());
        var block = forest.get(0);
        assertEquals(1, block.startLine());
        assertEquals(5, block.endLine());
        assertEquals(2, block.branches().size());

        var ifdef = block.branches().get(0);
        assertEquals(ConditionKind.IFDEF, ifdef.kind());
        assertEquals("#ifdef FOO", ifdef.rawText());
        assertEquals(1, ifdef.startLine());
        assertEquals(2, ifdef.endLine());

        var otherwise = block.branches().get(1);
        assertEquals(ConditionKind.ELSE, otherwise.kind());
        assertEquals(3, otherwise.startLine());
        assertEquals(5, otherwise.endLine());
    }

    @Test
    void parse_NestedBlock_AttachesToEnclosingBranch() {
        var forest = parser.parse(List.of("#if A", "#if B", "x();", "#endif", "#elif C", "y();", "#endif"), 1);

        assertEquals(1, forest.size());
        var branches = forest.get(0).branches();
        assertEquals(List.of(ConditionKind.IF, ConditionKind.ELIF), branches.stream().map(ConditionBranch::kind).toList());

        var nested = branches.get(0).children();
        assertEquals(1, nested.size());
        assertEquals(2, nested.get(0).startLine());
        assertEquals(4, nested.get(0).endLine());
        assertTrue(branches.get(1).children().isEmpty());
        assertEquals(5, branches.get(1).startLine());
    }

    @Test
    void parse_WhitespaceAfterHash_IsRecognized() {
        var forest = parser.parse(List.of("  #  if X == 1", "x();", "# endif"), 1);

        assertEquals(1, forest.size());
        assertEquals("#if X == 1", forest.get(0).branches().get(0).rawText());
    }

    @Test
    void parse_ContinuedDirective_JoinsLines() {
        var forest = parser.parse(List.of("#if defined(A) && \\", "    defined(B)", "x();", "#endif"), 1);

        var branch = forest.get(0).branches().get(0);
        assertEquals("#if defined(A) && defined(B)", branch.rawText());
        assertEquals(4, forest.get(0).endLine());
    }

    @Test
    void parse_ErrorDirective_MarksBranchUnreachable() {
        var forest = parser.parse(List.of("#if A", "int x;", "#else", "#error \"unsupported\"", "#endif"), 1);

        var block = forest.get(0);
        assertFalse(block.branches().get(0).hasErrorDirective());
        assertTrue(block.branches().get(1).hasErrorDirective());
        assertEquals(1, block.reachableBranches().size());
    }

    @Test
    void parse_ErrorInsideNestedBlock_DoesNotMarkOuterBranch() {
        var forest = parser.parse(List.of("#ifdef A", "#ifdef B", "#error nope", "#endif", "#endif"), 1);

        var outer = forest.get(0).branches().get(0);
        assertFalse(outer.hasErrorDirective());
        assertTrue(outer.children().get(0).branches().get(0).hasErrorDirective());
    }

    @Test
    void parse_StrayAndUnterminatedDirectives_AreDropped() {
        assertTrue(parser.parse(List.of("#endif", "#else", "#if A", "x();"), 1).isEmpty());
        assertTrue(parser.parse(List.of("#if A", "#if B", "#endif"), 1).isEmpty());
    }

    @Test
    void parse_WithLineOffset_NumbersFromFirstLine() {
        var forest = parser.parse(List.of("void f(void) {", "#ifdef X", "a();", "#endif", "}"), 10);

        assertEquals(11, forest.get(0).startLine());
        assertEquals(13, forest.get(0).endLine());
    }

    @Test
    void parse_NonConditionalDirectives_AreIgnored() {
        var forest = parser.parse(List.of("#include <stdio.h>", "#define X 1", "#ifdef X", "#endif"), 1);

        assertEquals(1, forest.size());
        assertEquals(3, forest.get(0).startLine());
    }
}
