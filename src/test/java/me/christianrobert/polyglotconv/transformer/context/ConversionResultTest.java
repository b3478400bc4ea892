package me.christianrobert.polyglotconv.transformer.context;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConversionResultTest {

    @Test
    void success() {
        ConversionResult result = ConversionResult.success("r.expr(1)");

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals("r.expr(1)", result.getJavaCode());
        assertNull(result.getReason());
    }

    @Test
    void failureKeepsExceptionKind() {
        ConversionResult unhandled = ConversionResult.failure(new UnhandledConstructException("no rule"));
        ConversionResult skipped = ConversionResult.failure(new SkippedConstructException("not for Java"));

        assertTrue(unhandled.isUnhandled());
        assertEquals("no rule", unhandled.getReason());
        assertTrue(skipped.isSkipped());
        assertEquals("not for Java", skipped.getReason());
        assertNull(skipped.getJavaCode());
    }

    @Test
    void reasonPrefix() {
        ConversionResult result = ConversionResult.unhandled("boom").withReasonPrefix("Run option 'x': ");

        assertTrue(result.isUnhandled());
        assertEquals("Run option 'x': boom", result.getReason());
    }

    @Test
    void reasonPrefixLeavesSuccessAlone() {
        ConversionResult result = ConversionResult.success("1");

        assertSame(result, result.withReasonPrefix("ignored"));
    }

    @Test
    void detailedMessage() {
        UnhandledConstructException e = new UnhandledConstructException("no rule", "a // b", "binary operator");

        assertEquals("no rule\nSource: a // b\nContext: binary operator", e.getDetailedMessage());
        assertEquals("plain", new UnhandledConstructException("plain").getDetailedMessage());
    }
}
