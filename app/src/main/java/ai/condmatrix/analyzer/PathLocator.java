package ai.condmatrix.analyzer;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the assignments that must hold for a given line to be compiled: the translated conditions of every branch
 * enclosing it, outermost first.
 */
public final class PathLocator {
    private final ConditionTranslator translator;

    public PathLocator(ConditionTranslator translator) {
        this.translator = translator;
    }

    public PathLocator() {
        this(new ConditionTranslator());
    }

    /**
     * @return the enclosing branches' assignments in nesting order; {@code []} if no branch encloses the line
     */
    public List<MacroAssignment> locate(List<ConditionBlock> forest, int targetLine) {
        var path = new ArrayList<MacroAssignment>();
        collect(forest, targetLine, path);
        return List.copyOf(path);
    }

    private void collect(List<ConditionBlock> blocks, int targetLine, List<MacroAssignment> path) {
        for (var block : blocks) {
            var branch = block.branchContaining(targetLine);
            if (branch.isPresent()) {
                path.addAll(translator.translate(branch.get(), block).assignments());
                collect(branch.get().children(), targetLine, path);
                return;
            }
        }
    }
}
