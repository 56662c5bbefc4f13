package ai.condmatrix.analyzer;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Name and value conventions shared by the translator, the normalizer and the filters.
 */
public final class MacroNameRules {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern CONVENTIONAL_MACRO = Pattern.compile("[A-Z_][A-Z0-9_]*");
    private static final Pattern DECIMAL = Pattern.compile("(\\d+)[uUlL]*");

    /**
     * Conventional boolean/status symbols (AUTOSAR and friends) and the integers they stand for. A comparison that
     * puts one of these on the left is assumed to have its operands reversed.
     */
    private static final Map<String, Integer> STANDARD_VALUES = Map.ofEntries(
            Map.entry("STD_ON", 1),
            Map.entry("STD_OFF", 0),
            Map.entry("TRUE", 1),
            Map.entry("FALSE", 0),
            Map.entry("E_OK", 0),
            Map.entry("E_NOT_OK", 1),
            Map.entry("NULL_PTR", 0),
            Map.entry("ENABLED", 1),
            Map.entry("DISABLED", 0),
            Map.entry("ACTIVE", 1),
            Map.entry("INACTIVE", 0),
            Map.entry("AUTOMATIC", 0),
            Map.entry("STATIC", 1),
            Map.entry("TYPEDEF", 2),
            Map.entry("CONST", 1),
            Map.entry("VAR", 0),
            Map.entry("ENABLE", 1),
            Map.entry("DISABLE", 0));

    /** Lowercase; matching ignores case, so {@code VOID} and {@code _BOOL} are keywords too. */
    private static final Set<String> RESERVED_WORDS = Set.of(
            // C
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum",
            "extern", "float", "for", "goto", "if", "define", "int", "long", "register", "return", "short",
            "signed", "sizeof", "static", "struct", "switch", "typedef", "union", "unsigned", "void", "volatile",
            "while",
            // C99 / C11
            "inline", "restrict", "_bool", "_complex", "_imaginary", "_alignas", "_alignof", "_atomic",
            "_static_assert", "_noreturn", "_thread_local", "_generic",
            // C++
            "alignas", "alignof", "and", "and_eq", "asm", "bitand", "bitor", "bool", "catch", "class", "compl",
            "concept", "const_cast", "consteval", "constexpr", "constinit", "co_await", "co_return", "co_yield",
            "decltype", "delete", "dynamic_cast", "explicit", "export", "false", "friend", "mutable", "namespace",
            "new", "noexcept", "not", "not_eq", "nullptr", "operator", "or", "or_eq", "private", "protected",
            "public", "reflexpr", "reinterpret_cast", "requires", "static_assert", "static_cast", "template",
            "this", "thread_local", "throw", "true", "try", "typeid", "typename", "using", "virtual", "wchar_t",
            "xor", "xor_eq");

    private static final String STRUCTURAL_CHARS = ".[]{}\"'";

    private MacroNameRules() {}

    public static boolean isIdentifier(String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    /**
     * True for all-uppercase, underscore-separated names with no leading, trailing or doubled underscore, e.g.
     * {@code CAN_DEV_ERROR_DETECT}.
     */
    public static boolean isConventionalMacroName(String text) {
        return CONVENTIONAL_MACRO.matcher(text).matches()
                && text.chars().anyMatch(Character::isLetter)
                && !text.startsWith("_")
                && !text.endsWith("_")
                && !text.contains("__");
    }

    public static boolean isStandardSymbol(String text) {
        return STANDARD_VALUES.containsKey(text);
    }

    public static Optional<Integer> standardValue(String text) {
        return Optional.ofNullable(STANDARD_VALUES.get(text));
    }

    public static boolean isReservedWord(String text) {
        return RESERVED_WORDS.contains(text.toLowerCase(Locale.ROOT));
    }

    /**
     * Parses a decimal integer literal, ignoring {@code u}/{@code l} suffixes.
     */
    public static Optional<BigInteger> parseDecimal(String text) {
        var m = DECIMAL.matcher(text.strip());
        return m.matches() ? Optional.of(new BigInteger(m.group(1))) : Optional.empty();
    }

    public static boolean isDecimal(String text) {
        return parseDecimal(text).isPresent();
    }

    /**
     * The integer a value stands for: a decimal literal, or a standard symbol's value.
     */
    static OptionalLong numericMeaning(String text) {
        var decimal = parseDecimal(text);
        if (decimal.isPresent() && decimal.get().bitLength() < 63) {
            return OptionalLong.of(decimal.get().longValue());
        }
        var standard = STANDARD_VALUES.get(text.strip());
        return standard == null ? OptionalLong.empty() : OptionalLong.of(standard);
    }

    /**
     * Repairs an assignment whose name and value were parsed the wrong way round: {@code L=R} becomes {@code R=L}
     * when {@code L} is not a conventional macro name but {@code R} is, or when both are and {@code L} is a standard
     * symbol while {@code R} is not ({@code STD_ON=CANNM_ENABLED} from {@code #if (STD_ON == CANNM_ENABLED)}).
     * Applying it twice gives the same result as applying it once.
     */
    public static MacroAssignment normalizeOrder(MacroAssignment assignment) {
        if (!(assignment.value() instanceof AssignmentValue.Literal literal)) {
            return assignment;
        }
        var left = assignment.name();
        var right = literal.value();
        boolean leftConventional = isConventionalMacroName(left);
        boolean rightConventional = isConventionalMacroName(right);
        if (!leftConventional && rightConventional) {
            return assignment.swapped();
        }
        if (leftConventional && rightConventional && isStandardSymbol(left) && !isStandardSymbol(right)) {
            return assignment.swapped();
        }
        return assignment;
    }

    /**
     * True if {@code name} can be passed to a compiler as a macro: no call syntax, no whitespace or structural
     * punctuation, a valid identifier, and not a C/C++ keyword.
     */
    public static boolean isCompilableName(String name) {
        if (name.isEmpty() || name.indexOf('(') >= 0 || name.indexOf(')') >= 0) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || STRUCTURAL_CHARS.indexOf(c) >= 0) {
                return false;
            }
        }
        return isIdentifier(name) && !isReservedWord(name);
    }

    /** True if the assignment survives filtering: a compilable name and a non-sentinel value. */
    public static boolean isCompilable(MacroAssignment assignment) {
        return isCompilableName(assignment.name()) && !assignment.value().isSentinel();
    }
}
