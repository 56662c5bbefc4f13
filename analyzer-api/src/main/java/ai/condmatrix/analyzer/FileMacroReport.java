package ai.condmatrix.analyzer;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * The analysis of one source file: per-function configurations plus the merged file-wide build matrix.
 */
public record FileMacroReport(Path file, List<FunctionReport> functions, List<MacroCombination> matrix) {

    public FileMacroReport {
        Objects.requireNonNull(file, "file cannot be null");
        functions = List.copyOf(functions);
        matrix = List.copyOf(matrix);
    }

    public List<FunctionReport> functionsNamed(String name) {
        return functions.stream()
                .filter(report -> report.function().name().equals(name))
                .toList();
    }
}
