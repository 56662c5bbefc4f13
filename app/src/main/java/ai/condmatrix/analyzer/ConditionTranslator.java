package ai.condmatrix.analyzer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Turns one branch's directive into the macro assignments that make the branch the one compiled.
 *
 * <p>Translation is symbolic and deliberately shallow:</p>
 * <ul>
 *   <li>{@code #ifdef X} → {@code X=1}; {@code #ifndef X} → {@code X=0}
 *   <li>{@code A && B} → the assignments of both operands
 *   <li>{@code A || B} → the assignments of {@code A} only; the first alternative stands in for the rest
 *   <li>{@code X == V}, {@code X >= V}, {@code X <= V} → {@code X=V}; {@code X > V} → {@code X=V+1};
 *       {@code X < V} → {@code X=max(0, V-1)}; {@code X != V} → a value other than {@code V}
 *   <li>{@code defined(X)}, bare {@code X} → {@code X=1}; {@code !defined(X)}, {@code !X} → {@code X=0}
 *   <li>{@code #else} → a value unclaimed by the chain's other branches
 * </ul>
 * <p>Anything else (function-like calls, arithmetic, bare numbers) translates to nothing, which makes the branch
 * unconstrained rather than failing. The literal {@code #if 0} translates to {@link MacroAssignment#STATICALLY_FALSE}
 * so that code inside it can be recognized as permanently disabled.</p>
 */
public final class ConditionTranslator {
    private static final Logger logger = LogManager.getLogger(ConditionTranslator.class);

    private static final Pattern DIRECTIVE_MACRO = Pattern.compile("#\\s*ifn?def\\s+(\\w+)");
    private static final Pattern CALL = Pattern.compile("([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern DEFINED_CALL = Pattern.compile("defined\\s*\\(\\s*(\\w+)\\s*\\)");
    private static final Pattern DEFINED_WORD = Pattern.compile("defined\\s+(\\w+)");
    private static final Pattern LEADING_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern EQUALITY = Pattern.compile("(\\w+)\\s*==\\s*(\\w+)");
    private static final Pattern GREATER_THAN = Pattern.compile("(\\w+)\\s*>\\s*(\\d+)");

    /** Comparison operators, longest first so that {@code >=} is not read as {@code >}. */
    private static final List<String> OPERATORS = List.of("!=", "==", ">=", "<=", ">", "<");

    /**
     * Translates {@code branch}, using {@code enclosingBlock} to reason about {@code #else} arms.
     */
    public Translated translate(ConditionBranch branch, ConditionBlock enclosingBlock) {
        var translated =
                switch (branch.kind()) {
                    case IFDEF -> directiveMacro(branch.rawText())
                            .map(name -> Translated.of(MacroAssignment.of(name, "1")))
                            .orElse(Translated.none());
                    case IFNDEF -> directiveMacro(branch.rawText())
                            .map(name -> Translated.of(MacroAssignment.of(name, "0")))
                            .orElse(Translated.none());
                    case IF, ELIF -> translateExpression(expressionOf(branch.rawText()));
                    case ELSE -> translateElse(enclosingBlock);
                };
        if (translated.isEmpty()) {
            logger.debug("No assignment for '{}' at line {}", branch.rawText(), branch.startLine());
        }
        return translated;
    }

    /**
     * Translates a bare {@code #if}/{@code #elif} expression.
     */
    public Translated translateExpression(String expression) {
        return Translated.of(parseCompound(expression));
    }

    // ---------------------------------------------------------------------------------------------------------------
    // #if / #elif

    /**
     * The expression part of an {@code #if}/{@code #elif} line, trailing comment removed and one layer of
     * fully-enclosing parentheses stripped.
     */
    @VisibleForTesting
    static String expressionOf(String rawText) {
        var text = rawText.strip();
        int keywordEnd = 1;
        while (keywordEnd < text.length() && Character.isLetter(text.charAt(keywordEnd))) {
            keywordEnd++;
        }
        var expr = text.substring(keywordEnd);
        int blockComment = expr.indexOf("/*");
        if (blockComment >= 0) {
            expr = expr.substring(0, blockComment);
        }
        int lineComment = expr.indexOf("//");
        if (lineComment >= 0) {
            expr = expr.substring(0, lineComment);
        }
        return stripEnclosingParens(expr.strip());
    }

    private List<MacroAssignment> parseCompound(String expression) {
        var expr = expression.strip();
        if (expr.isEmpty()) {
            return List.of();
        }
        if (!isBalanced(expr)) {
            logger.debug("Unbalanced parentheses in '{}'", expr);
            return List.of();
        }
        expr = stripEnclosingParens(expr);

        var alternatives = splitTopLevel(expr, "||");
        if (alternatives.size() > 1) {
            return parseCompound(alternatives.get(0));
        }

        var conjuncts = splitTopLevel(expr, "&&");
        if (conjuncts.size() > 1) {
            var result = new ArrayList<MacroAssignment>();
            for (var conjunct : conjuncts) {
                result.addAll(parseCompound(conjunct));
            }
            return result;
        }

        return parseSingle(expr).map(List::of).orElse(List.of());
    }

    private Optional<MacroAssignment> parseSingle(String condition) {
        var c = condition.strip();
        if (!c.startsWith("defined") && containsFunctionCall(c)) {
            return Optional.empty();
        }
        c = stripAllEnclosingParens(c);

        if (c.startsWith("!") && !c.startsWith("!=")) {
            return negated(stripAllEnclosingParens(c.substring(1).strip()));
        }

        var defined = definedMacro(c);
        if (defined.isPresent()) {
            return defined.map(name -> MacroAssignment.of(name, "1"));
        }

        for (var operator : OPERATORS) {
            if (c.contains(operator)) {
                var parts = c.split(Pattern.quote(operator), -1);
                return parts.length == 2 ? comparison(operator, parts[0], parts[1]) : Optional.empty();
            }
        }

        var name = cleanMacroName(c);
        var decimal = MacroNameRules.parseDecimal(name);
        if (decimal.isPresent()) {
            return decimal.get().signum() == 0 ? Optional.of(MacroAssignment.STATICALLY_FALSE) : Optional.empty();
        }
        if (!MacroNameRules.isIdentifier(name)) {
            return Optional.empty();
        }
        return Optional.of(MacroAssignment.of(name, "1"));
    }

    private static Optional<MacroAssignment> negated(String operand) {
        var defined = definedMacro(operand);
        if (defined.isPresent()) {
            return defined.map(name -> MacroAssignment.of(name, "0"));
        }
        if (MacroNameRules.isIdentifier(operand) && !MacroNameRules.isDecimal(operand)) {
            return Optional.of(MacroAssignment.of(operand, "0"));
        }
        return Optional.empty();
    }

    private static Optional<MacroAssignment> comparison(String operator, String leftText, String rightText) {
        var left = stripAllEnclosingParens(leftText.strip());
        var right = stripAllEnclosingParens(rightText.strip());
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }

        if (MacroNameRules.isStandardSymbol(left) && !MacroNameRules.isStandardSymbol(right)) {
            var tmp = left;
            left = right;
            right = tmp;
            operator = mirror(operator);
        }

        var name = cleanMacroName(left);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        var decimal = MacroNameRules.parseDecimal(right);

        String value =
                switch (operator) {
                    case "!=" -> notEqualValue(right, decimal.orElse(null));
                    case ">" -> decimal.map(v -> v.add(BigInteger.ONE).toString()).orElse(right);
                    case "<" -> decimal.map(v -> v.subtract(BigInteger.ONE).max(BigInteger.ZERO).toString())
                            .orElse("0");
                    default -> right;
                };
        return Optional.of(MacroAssignment.of(name, value));
    }

    private static String notEqualValue(String right, @Nullable BigInteger decimal) {
        if (decimal != null) {
            if (decimal.equals(BigInteger.ZERO)) return "1";
            if (decimal.equals(BigInteger.ONE)) return "0";
            return decimal.add(BigInteger.ONE).toString();
        }
        return MacroNameRules.standardValue(right)
                .map(standard -> Integer.toString(standard + 1))
                .orElse("0");
    }

    private static String mirror(String operator) {
        return switch (operator) {
            case ">" -> "<";
            case "<" -> ">";
            case ">=" -> "<=";
            case "<=" -> ">=";
            default -> operator;
        };
    }

    // ---------------------------------------------------------------------------------------------------------------
    // #else

    /**
     * Recovers the macro governing a chain from its reachable {@code #if}/{@code #elif}/{@code #ifdef}/{@code #ifndef}
     * arms and picks a value none of them claims.
     */
    private Translated translateElse(ConditionBlock block) {
        @Nullable String governing = null;
        var claimed = new TreeSet<Long>();

        for (var sibling : block.reachableBranches()) {
            switch (sibling.kind()) {
                case IFDEF -> {
                    var name = directiveMacro(sibling.rawText());
                    if (name.isPresent()) {
                        return Translated.of(MacroAssignment.undefined(name.get()));
                    }
                }
                case IFNDEF -> {
                    var name = directiveMacro(sibling.rawText());
                    if (name.isPresent()) {
                        return Translated.of(MacroAssignment.of(name.get(), "1"));
                    }
                }
                case IF, ELIF -> {
                    var expr = stripAllEnclosingParens(expressionOf(sibling.rawText()));
                    var equality = EQUALITY.matcher(expr);
                    var greater = GREATER_THAN.matcher(expr);
                    if (equality.find()) {
                        var name = equality.group(1);
                        var value = equality.group(2);
                        if (MacroNameRules.isStandardSymbol(name) && !MacroNameRules.isStandardSymbol(value)) {
                            var tmp = name;
                            name = value;
                            value = tmp;
                        }
                        var meaning = MacroNameRules.numericMeaning(value);
                        if (meaning.isPresent() && (governing == null || governing.equals(name))) {
                            governing = name;
                            claimed.add(meaning.getAsLong());
                        }
                    } else if (sibling.kind() == ConditionKind.IF
                            && greater.find()
                            && new BigInteger(greater.group(2)).signum() == 0) {
                        if (governing == null) {
                            governing = greater.group(1);
                        }
                    } else {
                        var negatedDefined = expr.startsWith("!")
                                ? definedMacro(stripAllEnclosingParens(expr.substring(1).strip()))
                                : Optional.<String>empty();
                        if (negatedDefined.isPresent()) {
                            return Translated.of(MacroAssignment.of(negatedDefined.get(), "1"));
                        }
                        var defined = definedMacro(expr);
                        if (defined.isPresent()) {
                            return Translated.of(MacroAssignment.undefined(defined.get()));
                        }
                        if (MacroNameRules.isIdentifier(expr) && !MacroNameRules.isDecimal(expr)) {
                            if (governing == null) {
                                governing = expr;
                            }
                            if (governing.equals(expr) && claimed.isEmpty()) {
                                claimed.add(1L);
                            }
                        }
                    }
                }
                case ELSE -> {
                    // the arm being translated
                }
            }
        }

        if (governing == null) {
            return Translated.none();
        }
        long value = claimed.contains(0L) ? claimed.last() + 1 : 0L;
        return Translated.of(MacroAssignment.of(governing, value));
    }

    // ---------------------------------------------------------------------------------------------------------------
    // text helpers

    private static Optional<String> directiveMacro(String rawText) {
        var m = DIRECTIVE_MACRO.matcher(rawText);
        return m.lookingAt() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /** {@code defined(X)} or {@code defined X} at the start of {@code text}. */
    private static Optional<String> definedMacro(String text) {
        for (var pattern : List.of(DEFINED_CALL, DEFINED_WORD)) {
            Matcher m = pattern.matcher(text);
            if (m.lookingAt()) {
                return Optional.of(m.group(1));
            }
        }
        return Optional.empty();
    }

    private static boolean containsFunctionCall(String text) {
        var m = CALL.matcher(text);
        while (m.find()) {
            if (!m.group(1).equals("defined")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reduces the left operand of a comparison to the macro name it tests: drops a {@code defined} prefix and stray
     * parentheses and keeps the leading identifier.
     */
    @VisibleForTesting
    static String cleanMacroName(String text) {
        var name = text.strip();
        if (name.startsWith("defined(")) {
            name = name.substring("defined(".length());
            while (name.endsWith(")")) {
                name = name.substring(0, name.length() - 1);
            }
        } else if (name.startsWith("defined ")) {
            name = name.substring("defined ".length());
        }
        name = trimChars(name.strip(), "()");
        var m = LEADING_IDENTIFIER.matcher(name);
        return m.lookingAt() ? m.group() : name;
    }

    private static String trimChars(String text, String chars) {
        int start = 0;
        int end = text.length();
        while (start < end && chars.indexOf(text.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(text.charAt(end - 1)) >= 0) end--;
        return text.substring(start, end).strip();
    }

    @VisibleForTesting
    static boolean isBalanced(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /** Removes one pair of parentheses if they enclose the whole text. */
    @VisibleForTesting
    static String stripEnclosingParens(String text) {
        if (!text.startsWith("(") || !text.endsWith(")")) {
            return text;
        }
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    return text;
                }
            }
        }
        return depth == 0 ? text.substring(1, text.length() - 1).strip() : text;
    }

    private static String stripAllEnclosingParens(String text) {
        var current = text;
        while (true) {
            var stripped = stripEnclosingParens(current);
            if (stripped.equals(current)) {
                return current;
            }
            current = stripped;
        }
    }

    /** Splits at every occurrence of {@code operator} outside parentheses. */
    private static List<String> splitTopLevel(String text, String operator) {
        var parts = new ArrayList<String>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && text.startsWith(operator, i)) {
                parts.add(text.substring(start, i).strip());
                start = i + operator.length();
                i = start - 1;
            }
        }
        parts.add(text.substring(start).strip());
        return parts;
    }
}
