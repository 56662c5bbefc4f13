package ai.condmatrix.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.condmatrix.util.CCommentStripper;
import ai.condmatrix.util.InMemoryCombinationCache;
import ai.condmatrix.util.TreeSitterFunctionLocator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MacroMatrixServiceTest {

    static final String SOURCE =
            """
            #ifdef FOO
            int f(void) { return 1; }
            #else
            int f(void) { return 0; }
            #endif
            /*
            #if BAR
            */
            int g(int x)
            {
            #if (MODE == 1) && (LEVEL >= 2)
                return x;
            #endif
                return 0;
            }
            """;

    @TempDir
    Path tempDir;

    private final InMemoryCombinationCache cache = new InMemoryCombinationCache();

    private MacroMatrixService service(CombinationCache cache) {
        return new MacroMatrixService(
                new CCommentStripper(),
                new TreeSitterFunctionLocator(),
                new FunctionMacroAnalyzer(),
                new FileLevelAggregator(),
                cache);
    }

    private static List<List<String>> strings(List<MacroCombination> combinations) {
        return combinations.stream().map(MacroCombination::toStrings).toList();
    }

    @Test
    void analyzeSource_ReportsEveryFunctionAndTheFileMatrix() {
        var report = service(CombinationCache.NONE).analyzeSource(Path.of("sample.c"), SOURCE);

        var labels = report.functions().stream().map(f -> f.function().label()).toList();
        assertEquals(List.of("f:2-2", "f:4-4", "g:9-15"), labels);

        assertEquals(List.of(List.of("FOO=1")), strings(report.functions().get(0).combinations()));
        assertTrue(report.functions().get(1).isUnconstrained());
        assertEquals(List.of(List.of("MODE=1", "LEVEL=2")), strings(report.functions().get(2).combinations()));

        assertEquals(List.of(List.of("FOO=1", "MODE=1", "LEVEL=2")), strings(report.matrix()));
        assertEquals(2, report.functionsNamed("f").size());
    }

    @Test
    @DisplayName("#ifdef A, #if B == 1, #if B == 2 around sibling functions give two matrix rows sharing A")
    void analyzeSource_SiblingChains_CrossConflictingValuesInMatrix() {
        var source = String.join(
                "\n",
                "#ifdef A",
                "void a(void) { }",
                "#endif",
                "#if B == 1",
                "void b1(void) { }",
                "#endif",
                "#if B == 2",
                "void b2(void) { }",
                "#endif");

        var report = service(CombinationCache.NONE).analyzeSource(Path.of("siblings.c"), source);

        var labels = report.functions().stream().map(f -> f.function().label()).toList();
        assertEquals(List.of("a:2-2", "b1:5-5", "b2:8-8"), labels);
        assertEquals(List.of(List.of("A=1", "B=1"), List.of("A=1", "B=2")), strings(report.matrix()));
    }

    @Test
    void analyzeSource_CommentedOutChain_OnlyCountsWhenCommentsAreKept() {
        var source = String.join("\n", "int f(void) {", "/*", "#ifdef OLD", "*/", "    return 0;", "/*", "#endif", "*/", "}");
        var keepComments = new MacroMatrixService(
                CommentStripper.NONE,
                new TreeSitterFunctionLocator(),
                new FunctionMacroAnalyzer(),
                new FileLevelAggregator(),
                CombinationCache.NONE);

        var stripped = service(CombinationCache.NONE).analyzeSource(Path.of("old.c"), source);
        var kept = keepComments.analyzeSource(Path.of("old.c"), source);

        assertTrue(stripped.functions().get(0).isUnconstrained());
        assertEquals("f:1-9", kept.functions().get(0).function().label());
        assertEquals(List.of(List.of("OLD=1")), strings(kept.functions().get(0).combinations()));
    }

    @Test
    void analyzeFile_UnchangedFile_IsServedFromCache() throws IOException {
        var file = tempDir.resolve("sample.c");
        Files.writeString(file, SOURCE);
        var service = service(cache);

        var first = service.analyzeFile(file);
        var second = service.analyzeFile(file);

        assertSame(first, second);
        assertEquals(1, cache.size());
        assertEquals(file.toAbsolutePath(), first.file());
    }

    @Test
    void analyzeFile_ModifiedFile_IsReanalyzed() throws IOException {
        var file = tempDir.resolve("sample.c");
        Files.writeString(file, SOURCE);
        var service = service(cache);
        var first = service.analyzeFile(file);

        Files.writeString(file, "#ifdef ONLY\nint k(void) { return 0; }\n#endif\n");
        var modified = Files.getLastModifiedTime(file).toMillis() + 5_000;
        Files.setLastModifiedTime(file, FileTime.fromMillis(modified));
        var second = service.analyzeFile(file);

        assertNotSame(first, second);
        assertEquals(List.of(List.of("ONLY=1")), strings(second.matrix()));
        assertEquals(1, cache.size());
    }

    @Test
    void analyzeFile_MissingFile_Throws() {
        assertThrows(NoSuchFileException.class, () -> service(cache).analyzeFile(tempDir.resolve("missing.c")));
    }
}
