package ai.condmatrix.cli;

import ai.condmatrix.analyzer.CombinationCache;
import ai.condmatrix.analyzer.CommentStripper;
import ai.condmatrix.analyzer.CompilerFlags;
import ai.condmatrix.analyzer.FileLevelAggregator;
import ai.condmatrix.analyzer.FileMacroReport;
import ai.condmatrix.analyzer.FunctionMacroAnalyzer;
import ai.condmatrix.analyzer.FunctionReport;
import ai.condmatrix.analyzer.MacroCombination;
import ai.condmatrix.analyzer.MacroMatrixService;
import ai.condmatrix.util.AnalyzerSettings;
import ai.condmatrix.util.CCommentStripper;
import ai.condmatrix.util.InMemoryCombinationCache;
import ai.condmatrix.util.TreeSitterFunctionLocator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "condmatrix",
        mixinStandardHelpOptions = true,
        description = "Enumerates the preprocessor configurations under which each function of a C file compiles.")
public final class CondMatrixCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CondMatrixCli.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "The C source file to analyze.")
    private Path file;

    @CommandLine.Option(names = "--function", description = "Only report the named function. Can be repeated.")
    private List<String> functionNames = new ArrayList<>();

    @CommandLine.Option(names = "--matrix", description = "Print the file-level configuration matrix.")
    private boolean matrix = false;

    @CommandLine.Option(names = "--gcc-flags", description = "Print the file-level matrix as -D flag groups.")
    private boolean gccFlags = false;

    @CommandLine.Option(names = "--json", description = "Print the whole report as JSON.")
    private boolean json = false;

    @CommandLine.Option(names = "--config", description = "Settings file (default: ./condmatrix.properties).")
    @Nullable
    private Path configFile;

    @CommandLine.Option(names = "--keep-comments", description = "Do not strip comments before parsing.")
    private boolean keepComments = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CondMatrixCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        var settings = configFile == null ? AnalyzerSettings.load() : AnalyzerSettings.load(configFile);
        if (keepComments) {
            settings = settings.withStripComments(false);
        }

        FileMacroReport report;
        try {
            report = createService(settings).analyzeFile(file);
        } catch (IOException e) {
            logger.error("Failed to analyze {}", file, e);
            err.println("Error reading " + file + ": " + e.getMessage());
            return 1;
        }

        var functions = selectFunctions(report, err);

        if (json) {
            try {
                out.println(toJson(report, functions));
            } catch (JsonProcessingException e) {
                logger.error("Failed to serialize report for {}", file, e);
                err.println("Error writing JSON: " + e.getMessage());
                return 1;
            }
            out.flush();
            return 0;
        }

        if (!matrix && !gccFlags) {
            functions.forEach(f -> printFunction(out, f));
        }
        if (matrix) {
            out.println("File matrix (" + report.matrix().size() + " combination(s)):");
            printCombinations(out, report.matrix());
        }
        if (gccFlags) {
            for (var flags : CompilerFlags.toFlags(report.matrix())) {
                out.println(String.join(" ", flags));
            }
        }
        out.flush();
        return 0;
    }

    static MacroMatrixService createService(AnalyzerSettings settings) {
        CommentStripper stripper = settings.stripComments() ? new CCommentStripper() : CommentStripper.NONE;
        CombinationCache cache = settings.cacheEnabled() ? new InMemoryCombinationCache() : CombinationCache.NONE;
        return new MacroMatrixService(
                stripper,
                new TreeSitterFunctionLocator(),
                new FunctionMacroAnalyzer(settings.repairMacroOrder()),
                new FileLevelAggregator(),
                cache);
    }

    private List<FunctionReport> selectFunctions(FileMacroReport report, PrintWriter err) {
        if (functionNames.isEmpty()) {
            return report.functions();
        }
        var selected = new ArrayList<FunctionReport>();
        for (var name : functionNames) {
            var matches = report.functionsNamed(name);
            if (matches.isEmpty()) {
                err.println("No function named " + name + " in " + file);
            }
            selected.addAll(matches);
        }
        return selected;
    }

    private static void printFunction(PrintWriter out, FunctionReport function) {
        out.println(function.function().label());
        if (function.isExcluded()) {
            out.println("  statically disabled");
        } else if (function.isUnconstrained()) {
            out.println("  no conditional-compilation constraints");
        } else {
            printCombinations(out, function.combinations());
        }
    }

    private static void printCombinations(PrintWriter out, List<MacroCombination> combinations) {
        int n = 1;
        for (var combination : combinations) {
            var text = combination.isEmpty() ? "(none)" : String.join(", ", combination.toStrings());
            out.println("  " + n++ + ": " + text);
        }
    }

    private static String toJson(FileMacroReport report, List<FunctionReport> functions)
            throws JsonProcessingException {
        var view = new JsonReport(
                report.file().toString(), functions, report.matrix(), CompilerFlags.toFlags(report.matrix()));
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(view);
    }

    public record JsonReport(
            String file, List<FunctionReport> functions, List<MacroCombination> matrix, List<List<String>> gccFlags) {}
}
