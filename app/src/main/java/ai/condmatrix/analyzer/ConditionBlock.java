package ai.condmatrix.analyzer;

import java.util.List;
import java.util.Optional;

/**
 * A complete {@code #if ... #endif} chain. Its branches are mutually exclusive and appear in source order: the
 * opening {@code #if}/{@code #ifdef}/{@code #ifndef}, any {@code #elif}s, and an optional trailing {@code #else}.
 */
public record ConditionBlock(List<ConditionBranch> branches, int startLine, int endLine) {

    public ConditionBlock {
        branches = List.copyOf(branches);
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("A block needs at least one branch");
        }
    }

    /** Branches that can actually be compiled, i.e. those without an {@code #error}. */
    public List<ConditionBranch> reachableBranches() {
        return branches.stream().filter(ConditionBranch::isReachable).toList();
    }

    /** The reachable branch whose span contains {@code line}, if any. */
    public Optional<ConditionBranch> branchContaining(int line) {
        return reachableBranches().stream().filter(b -> b.contains(line)).findFirst();
    }
}
