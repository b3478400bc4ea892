package me.christianrobert.polyglotconv.transformer.util;

import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class JavaLiteralFormatterTest {

    // ========== Strings ==========

    @Test
    void plainString() {
        assertEquals("\"abc\"", JavaLiteralFormatter.stringLiteral("abc"));
        assertEquals("\"\"", JavaLiteralFormatter.stringLiteral(""));
    }

    @Test
    void quotesAndBackslashesAreEscaped() {
        assertEquals("\"say \\\"hi\\\"\"", JavaLiteralFormatter.stringLiteral("say \"hi\""));
        assertEquals("\"a\\\\b\"", JavaLiteralFormatter.stringLiteral("a\\b"));
        assertEquals("\"it's\"", JavaLiteralFormatter.stringLiteral("it's"));
    }

    @Test
    void controlCharactersUseShortEscapes() {
        assertEquals("\"a\\nb\\tc\\r\"", JavaLiteralFormatter.stringLiteral("a\nb\tc\r"));
    }

    @Test
    void nonAsciiBecomesUnicodeEscape() {
        assertEquals("\"caf\\u00e9\"", JavaLiteralFormatter.stringLiteral("café"));
        assertEquals("\"\\u0000\"", JavaLiteralFormatter.stringLiteral("\0"));
    }

    // ========== Numbers ==========

    @Test
    void integersInIntRangeStayIntegers() {
        assertEquals("42", JavaLiteralFormatter.integerLiteral(BigInteger.valueOf(42)));
        assertEquals("2147483647", JavaLiteralFormatter.integerLiteral(BigInteger.valueOf(Integer.MAX_VALUE)));
        assertEquals("-2147483647", JavaLiteralFormatter.integerLiteral(BigInteger.valueOf(-Integer.MAX_VALUE)));
    }

    @Test
    void largeIntegersBecomeDoubles() {
        assertEquals("2147483648.0", JavaLiteralFormatter.integerLiteral(BigInteger.valueOf(2147483648L)));
        assertEquals("-10000000000.0", JavaLiteralFormatter.integerLiteral(BigInteger.valueOf(-10000000000L)));
    }

    @Test
    void floats() {
        assertEquals("1.5", JavaLiteralFormatter.floatLiteral(1.5));
        assertEquals("0.1", JavaLiteralFormatter.floatLiteral(0.1));
        assertEquals("1.0E20", JavaLiteralFormatter.floatLiteral(1e20));
    }

    @Test
    void nonFiniteFloatsAreUnhandled() {
        assertThrows(UnhandledConstructException.class, () -> JavaLiteralFormatter.floatLiteral(Double.POSITIVE_INFINITY));
        assertThrows(UnhandledConstructException.class, () -> JavaLiteralFormatter.floatLiteral(Double.NaN));
    }
}
