package ai.condmatrix.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CCommentStripperTest {

    private final CCommentStripper stripper = new CCommentStripper();

    @Test
    void strip_BlockComment_KeepsLineBreaks() {
        assertEquals("a     \n     b", stripper.strip("a /* x\ny */ b"));
    }

    @Test
    void strip_LineComment_BlanksToEndOfLine() {
        var stripped = stripper.strip("#if A // note\nint b;");
        assertEquals(2, stripped.lines().count());
        assertEquals("#if A", stripped.lines().findFirst().orElseThrow().stripTrailing());
        assertTrue(stripped.endsWith("\nint b;"));
    }

    @Test
    void strip_CommentMarkersInLiterals_AreKept() {
        var source = "char *s = \"/* not \\\" a comment */\"; char c = '/'; char d = '\\'';";
        assertEquals(source, stripper.strip(source));
    }

    @Test
    void strip_PreservesLength() {
        var source = "int x; /* one */ // two\n/* three\nfour */ int y;\n";
        var stripped = stripper.strip(source);
        assertEquals(source.length(), stripped.length());
        assertEquals(source.lines().count(), stripped.lines().count());
        assertFalse(stripped.contains("one"));
        assertFalse(stripped.contains("four"));
        assertTrue(stripped.contains("int y;"));
    }

    @Test
    void strip_UnterminatedBlockComment_BlanksRestOfFile() {
        assertEquals("int x;   \n   ", stripper.strip("int x; /*\nabc"));
    }
}
