package ai.condmatrix.analyzer;

import java.util.List;

/** Formats configurations as compiler command-line defines. */
public final class CompilerFlags {

    private CompilerFlags() {}

    /**
     * One {@code -DNAME=VALUE} group per non-empty combination; empty combinations need no flags and are skipped.
     */
    public static List<List<String>> toFlags(List<MacroCombination> combinations) {
        return combinations.stream()
                .filter(combination -> !combination.isEmpty())
                .map(MacroCombination::toCompilerFlags)
                .toList();
    }
}
