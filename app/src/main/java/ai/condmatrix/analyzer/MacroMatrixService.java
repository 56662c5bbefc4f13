package ai.condmatrix.analyzer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Analyzes whole C source files: every function's configurations plus the file-wide build matrix.
 */
public final class MacroMatrixService {
    private static final Logger logger = LogManager.getLogger(MacroMatrixService.class);

    private final CommentStripper commentStripper;
    private final FunctionRangeProvider functionLocator;
    private final FunctionMacroAnalyzer analyzer;
    private final FileLevelAggregator aggregator;
    private final CombinationCache cache;

    public MacroMatrixService(
            CommentStripper commentStripper,
            FunctionRangeProvider functionLocator,
            FunctionMacroAnalyzer analyzer,
            FileLevelAggregator aggregator,
            CombinationCache cache) {
        this.commentStripper = commentStripper;
        this.functionLocator = functionLocator;
        this.analyzer = analyzer;
        this.aggregator = aggregator;
        this.cache = cache;
    }

    /**
     * Analyzes {@code file}, serving the result from the cache when the file is unchanged since it was last analyzed.
     *
     * @throws IOException if the file cannot be read
     */
    public FileMacroReport analyzeFile(Path file) throws IOException {
        var absolute = file.toAbsolutePath();
        var key = new CombinationCache.Key(absolute, Files.getLastModifiedTime(absolute).toMillis());
        var cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        var source = Files.readString(absolute, StandardCharsets.UTF_8);
        var report = analyzeSource(absolute, source);
        cache.put(key, report);
        return report;
    }

    /** Analyzes in-memory source text; {@code file} is only recorded in the report. */
    public FileMacroReport analyzeSource(Path file, String source) {
        var lines = commentStripper.strip(source).lines().toList();
        var forest = analyzer.parseFile(lines);

        var functions = new ArrayList<FunctionReport>();
        for (var range : functionLocator.findFunctions(lines)) {
            functions.add(new FunctionReport(range, analyzer.analyze(lines, forest, range)));
        }

        List<List<MacroCombination>> perFunction =
                functions.stream().map(FunctionReport::combinations).toList();
        var matrix = aggregator.aggregate(perFunction);
        logger.debug("{}: {} function(s), {} matrix row(s)", file, functions.size(), matrix.size());
        return new FileMacroReport(file, functions, matrix);
    }
}
