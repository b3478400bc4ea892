package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.NameNode;
import me.christianrobert.polyglotconv.transformer.context.ConversionContext;
import me.christianrobert.polyglotconv.transformer.context.ReqlVariables;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import me.christianrobert.polyglotconv.transformer.parser.AntlrParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JavaCodeBuilderTest {

    private AntlrParser parser;
    private ConversionContext context;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
        context = new ConversionContext(ReqlVariables.of("r", "tbl"));
    }

    @Test
    void forTermPicksReqlModeForReqlExpressions() {
        JavaCodeBuilder b = JavaCodeBuilder.forTerm(context, parser.parseExpression("tbl.count() + 1"));

        assertSame(EmissionMode.REQL, b.getMode());
        assertEquals("r.add(tbl.count(), 1)", b.visit(parser.parseExpression("tbl.count() + 1")));
    }

    @Test
    void forTermPicksPlainModeForOtherExpressions() {
        JavaCodeBuilder b = JavaCodeBuilder.forTerm(context, parser.parseExpression("x + 1"));

        assertSame(EmissionMode.PLAIN, b.getMode());
        assertEquals("x + 1", b.visit(parser.parseExpression("x + 1")));
    }

    @Test
    void withModeKeepsContext() {
        JavaCodeBuilder plain = new JavaCodeBuilder(context);
        JavaCodeBuilder reql = plain.withMode(EmissionMode.REQL);

        assertSame(plain, plain.withMode(EmissionMode.PLAIN));
        assertSame(context, reql.getContext());
        assertTrue(reql.getMode().isReql());
        assertFalse(plain.getMode().isReql());
    }

    @Test
    void sameTreeConvertsDifferentlyPerMode() {
        JavaCodeBuilder plain = new JavaCodeBuilder(context);

        assertEquals("a + 1", plain.visit(parser.parseExpression("a + 1")));
        assertEquals("r.add(a, 1)", plain.withMode(EmissionMode.REQL).visit(parser.parseExpression("a + 1")));
    }

    @Test
    void constantNamesAreTranslated() {
        JavaCodeBuilder plain = new JavaCodeBuilder(context);

        assertEquals("null", plain.visit(new NameNode("nil")));
        assertEquals("other", plain.visit(new NameNode("other")));
    }

    @Test
    void missingNodeIsUnhandled() {
        assertThrows(UnhandledConstructException.class, () -> new JavaCodeBuilder(context).visit(null));
    }
}
