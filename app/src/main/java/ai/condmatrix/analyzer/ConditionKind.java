package ai.condmatrix.analyzer;

import java.util.Optional;

/** The directive that opens a branch of a conditional chain. */
public enum ConditionKind {
    IF("#if"),
    IFDEF("#ifdef"),
    IFNDEF("#ifndef"),
    ELIF("#elif"),
    ELSE("#else");

    private final String directive;

    ConditionKind(String directive) {
        this.directive = directive;
    }

    public String directive() {
        return directive;
    }

    /** True for the kinds that open a new block. */
    public boolean opensBlock() {
        return this == IF || this == IFDEF || this == IFNDEF;
    }

    /**
     * Classifies a normalized directive line ({@code #} immediately followed by the keyword).
     */
    static Optional<ConditionKind> ofDirective(String directive) {
        if (directive.startsWith("#ifdef")) return Optional.of(IFDEF);
        if (directive.startsWith("#ifndef")) return Optional.of(IFNDEF);
        if (directive.startsWith("#if")) return Optional.of(IF);
        if (directive.startsWith("#elif")) return Optional.of(ELIF);
        if (directive.startsWith("#else")) return Optional.of(ELSE);
        return Optional.empty();
    }
}
