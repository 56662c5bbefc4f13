package ai.condmatrix.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MacroNameRulesTest {

    @ParameterizedTest
    @CsvSource({
        "CAN_DEV_ERROR_DETECT, true",
        "X, true",
        "X1, true",
        "_X, false",
        "X_, false",
        "A__B, false",
        "Foo, false",
        "123, false",
        "STD_ON, true"
    })
    void isConventionalMacroName(String name, boolean expected) {
        assertEquals(expected, MacroNameRules.isConventionalMacroName(name));
    }

    @ParameterizedTest
    @CsvSource({
        "1=FOO, FOO=1",
        "STD_ON=CANNM_ENABLED, CANNM_ENABLED=STD_ON",
        "FOO=1, FOO=1",
        "FOO=BAR, FOO=BAR",
        "STD_ON=STD_OFF, STD_ON=STD_OFF",
        "foo=1, foo=1",
        "FOO=**remove**, FOO=**remove**"
    })
    void normalizeOrder(String input, String expected) {
        assertEquals(expected, MacroNameRules.normalizeOrder(MacroAssignment.parse(input)).toString());
    }

    @Test
    void normalizeOrder_IsIdempotent() {
        for (var text : List.of("1=FOO", "STD_ON=CANNM_ENABLED", "x=Y", "A=B", "0=1", "STD_OFF=X_Y")) {
            var once = MacroNameRules.normalizeOrder(MacroAssignment.parse(text));
            assertEquals(once, MacroNameRules.normalizeOrder(once), text);
        }
    }

    @ParameterizedTest
    @CsvSource({
        "FOO, true",
        "Int, false",
        "VOID, false",
        "_BOOL, false",
        "int, false",
        "static, false",
        "nullptr, false",
        "a.b, false",
        "f(x), false",
        "1X, false",
        "'A B', false"
    })
    void isCompilableName(String name, boolean expected) {
        assertEquals(expected, MacroNameRules.isCompilableName(name));
    }

    @Test
    void isCompilable_RejectsSentinelValues() {
        assertFalse(MacroNameRules.isCompilable(MacroAssignment.undefined("FOO")));
        assertTrue(MacroNameRules.isCompilable(MacroAssignment.of("FOO", "0")));
    }

    @Test
    void parseDecimal_IgnoresIntegerSuffixes() {
        assertEquals(Optional.of(BigInteger.valueOf(10)), MacroNameRules.parseDecimal("10UL"));
        assertTrue(MacroNameRules.parseDecimal("0x10").isEmpty());
        assertTrue(MacroNameRules.parseDecimal("FOO").isEmpty());
    }

    @Test
    void standardValue_LooksUpTable() {
        assertEquals(Optional.of(2), MacroNameRules.standardValue("TYPEDEF"));
        assertEquals(Optional.empty(), MacroNameRules.standardValue("STD_MAYBE"));
        assertTrue(MacroNameRules.isStandardSymbol("E_NOT_OK"));
    }
}
