package ai.condmatrix.util;

import ai.condmatrix.analyzer.ConditionBlock;
import ai.condmatrix.analyzer.ConditionTreeParser;
import ai.condmatrix.analyzer.FunctionRange;
import ai.condmatrix.analyzer.FunctionRangeProvider;
import ai.condmatrix.analyzer.MacroNameRules;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterC;

/**
 * Finds C function definitions with the tree-sitter C grammar.
 *
 * <p>The grammar cannot follow code whose braces only balance once a single arm of each conditional chain is chosen,
 * such as an {@code if} statement whose opening line is written once per arm. The file is therefore parsed as
 * several line-preserving views: view {@code k} keeps arm {@code k} of every chain (or its last arm, if it has fewer)
 * and blanks the others, the way the preprocessor would for one configuration. Definitions found in any view are
 * reported once, keyed by name and first line, in source order.</p>
 *
 * <p>AUTOSAR compiler-abstraction macros ({@code FUNC(void, CAN_CODE)}, {@code P2VAR(uint8, ...)}) are replaced by
 * the type they wrap before parsing, since the grammar reads them as calls.</p>
 */
public final class TreeSitterFunctionLocator implements FunctionRangeProvider {
    private static final Logger logger = LogManager.getLogger(TreeSitterFunctionLocator.class);

    private static final String FUNCTION_DEFINITION = "function_definition";

    private static final Pattern CONDITIONAL_DIRECTIVE =
            Pattern.compile("^\\s*#\\s*(if|ifdef|ifndef|elif|else|endif|error|warning|pragma)\\b");

    private static final Pattern TYPE_MACRO = Pattern.compile("\\b(FUNC|VAR|CONST)\\s*\\(\\s*([^,()]+?)\\s*,[^()]*\\)");
    private static final Pattern POINTER_MACRO = Pattern.compile(
            "\\b(FUNC_P2VAR|FUNC_P2CONST|P2VAR|P2CONST|CONSTP2VAR|CONSTP2CONST)\\s*\\(\\s*([^,()]+?)\\s*,[^()]*\\)");

    private static final Set<String> NOT_FUNCTIONS = Set.of(
            "if", "else", "for", "while", "switch", "do", "return", "break", "continue", "goto", "case", "default",
            "sizeof", "defined");

    private final ConditionTreeParser conditionParser;
    private final ThreadLocal<TSParser> parserCache;

    public TreeSitterFunctionLocator() {
        this(new ConditionTreeParser());
    }

    public TreeSitterFunctionLocator(ConditionTreeParser conditionParser) {
        this.conditionParser = conditionParser;
        this.parserCache = ThreadLocal.withInitial(() -> {
            var parser = new TSParser();
            parser.setLanguage(createTSLanguage());
            return parser;
        });
    }

    private static TSLanguage createTSLanguage() {
        return new TreeSitterC();
    }

    @Override
    public List<FunctionRange> findFunctions(List<String> lines) {
        var forest = conditionParser.parse(lines, 1);
        int views = Math.max(1, maxArms(forest));

        Map<String, FunctionRange> found = new LinkedHashMap<>();
        for (int arm = 0; arm < views; arm++) {
            var source = String.join("\n", view(lines, forest, arm));
            for (var range : parse(source)) {
                found.putIfAbsent(range.name() + "@" + range.startLine(), range);
            }
        }

        var result = new ArrayList<>(found.values());
        result.sort(Comparator.comparingInt(FunctionRange::startLine).thenComparing(FunctionRange::name));
        logger.debug("Found {} function(s) in {} view(s)", result.size(), views);
        return List.copyOf(result);
    }

    /**
     * The source as seen when arm {@code arm} of every chain is taken. Lines keep their numbering: directive lines and
     * the lines of unselected arms become blank, and compiler-abstraction macros are unwrapped.
     */
    @VisibleForTesting
    static List<String> view(List<String> lines, List<ConditionBlock> forest, int arm) {
        var result = new ArrayList<String>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (CONDITIONAL_DIRECTIVE.matcher(line).find()) {
                result.add("");
                while (line.stripTrailing().endsWith("\\") && i + 1 < lines.size()) {
                    line = lines.get(++i);
                    result.add("");
                }
                continue;
            }
            result.add(unwrapMacros(line));
        }
        blankUnselectedArms(result, forest, arm);
        return result;
    }

    private static void blankUnselectedArms(List<String> lines, List<ConditionBlock> blocks, int arm) {
        for (var block : blocks) {
            var branches = block.branches();
            int selected = Math.min(arm, branches.size() - 1);
            for (int b = 0; b < branches.size(); b++) {
                var branch = branches.get(b);
                if (b == selected) {
                    blankUnselectedArms(lines, branch.children(), arm);
                    continue;
                }
                for (int line = branch.startLine(); line <= branch.endLine() && line <= lines.size(); line++) {
                    lines.set(line - 1, "");
                }
            }
        }
    }

    private static int maxArms(List<ConditionBlock> blocks) {
        int max = 0;
        for (var block : blocks) {
            max = Math.max(max, block.branches().size());
            for (var branch : block.branches()) {
                max = Math.max(max, maxArms(branch.children()));
            }
        }
        return max;
    }

    private static String unwrapMacros(String line) {
        var typed = TYPE_MACRO.matcher(line).replaceAll(m -> Matcher.quoteReplacement(m.group(2)));
        return POINTER_MACRO.matcher(typed).replaceAll(m -> Matcher.quoteReplacement(m.group(2) + " *"));
    }

    private List<FunctionRange> parse(String source) {
        var tree = Objects.requireNonNull(parserCache.get().parseString(null, source), "Failed to parse source");
        var bytes = source.getBytes(StandardCharsets.UTF_8);
        var ranges = new ArrayList<FunctionRange>();
        collect(tree.getRootNode(), bytes, ranges);
        return ranges;
    }

    private static void collect(TSNode node, byte[] source, List<FunctionRange> ranges) {
        if (FUNCTION_DEFINITION.equals(node.getType())) {
            var name = functionName(node, source);
            if (name != null) {
                ranges.add(new FunctionRange(
                        name, node.getStartPoint().getRow() + 1, node.getEndPoint().getRow() + 1));
            }
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (!child.isNull()) {
                collect(child, source, ranges);
            }
        }
    }

    /**
     * The declared name of a {@code function_definition}, or null when the node is error recovery mistaking a
     * control statement or a macro invocation for a definition.
     */
    private static @Nullable String functionName(TSNode definition, byte[] source) {
        var type = definition.getChildByFieldName("type");
        if (type != null && !type.isNull() && NOT_FUNCTIONS.contains(text(type, source))) {
            return null;
        }

        var declarator = definition.getChildByFieldName("declarator");
        while (declarator != null
                && !declarator.isNull()
                && ("function_declarator".equals(declarator.getType())
                        || "pointer_declarator".equals(declarator.getType()))) {
            declarator = declarator.getChildByFieldName("declarator");
        }
        if (declarator == null || declarator.isNull() || !"identifier".equals(declarator.getType())) {
            return null;
        }

        var name = text(declarator, source);
        if (NOT_FUNCTIONS.contains(name) || MacroNameRules.isConventionalMacroName(name)) {
            return null;
        }
        return name;
    }

    private static String text(TSNode node, byte[] source) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }
}
