package ai.condmatrix.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;

/**
 * Configurations found for one function.
 *
 * @param function the analyzed range
 * @param combinations the filtered, normalized configurations; empty when the function is statically disabled
 */
public record FunctionReport(FunctionRange function, List<MacroCombination> combinations) {

    public FunctionReport {
        Objects.requireNonNull(function, "function cannot be null");
        combinations = List.copyOf(combinations);
    }

    /** True if no configuration reaches the function (e.g. it sits inside {@code #if 0}). */
    public boolean isExcluded() {
        return combinations.isEmpty();
    }

    /** True if the function compiles the same way under every configuration. */
    @JsonIgnore
    public boolean isUnconstrained() {
        return !combinations.isEmpty() && combinations.stream().allMatch(MacroCombination::isEmpty);
    }
}
