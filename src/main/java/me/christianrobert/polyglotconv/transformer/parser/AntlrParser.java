package me.christianrobert.polyglotconv.transformer.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.polyglotconv.antlr.PyExpressionLexer;
import me.christianrobert.polyglotconv.antlr.PyExpressionParser;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin wrapper around the generated PyExpression parser.
 * Handles parser instantiation, error collection, and turns parse trees into expression trees.
 *
 * Uses two-stage parsing:
 * 1. Try SLL(*) mode first (fast, bails out on the first error)
 * 2. Fall back to LL(*) mode with error recovery, collecting every syntax error
 *
 * This is the only class that directly instantiates ANTLR parsers.
 *
 * Note: Uses @Dependent scope because it is stateless and also instantiated with new
 * by the test file converter.
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    /**
     * Parses a single host-language line ({@code expr} or {@code name = expr}).
     *
     * @param source Source line
     * @return ParseResult containing the parse tree and any errors
     * @throws UnhandledConstructException if the source is null or blank
     */
    public ParseResult parseStatement(String source) {
        if (source == null || source.trim().isEmpty()) {
            throw new UnhandledConstructException("Source line cannot be null or empty");
        }

        log.trace("Parsing statement: {}", source);

        List<String> errors = new ArrayList<>();
        PyExpressionLexer lexer = new PyExpressionLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(collectingListener(errors));
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        // Stage 1: SLL(*) mode (fast path)
        PyExpressionParser parser = new PyExpressionParser(tokens);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

        PyExpressionParser.StatementContext tree;
        try {
            tree = parser.statement();
        } catch (ParseCancellationException sllException) {
            log.trace("SLL(*) parse failed, falling back to LL(*)");

            // Stage 2: LL(*) mode with full error recovery
            tokens.seek(0);
            parser.reset();
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.addErrorListener(collectingListener(errors));

            tree = parser.statement();
        }

        return new ParseResult(tree, errors, source);
    }

    /**
     * Parses a source line and builds its expression tree.
     *
     * @param source Source line
     * @return Root of the expression tree
     * @throws UnhandledConstructException if the line has syntax errors or contains a
     *         construct the tree builder rejects
     */
    public ExpressionNode parseExpression(String source) {
        ParseResult result = parseStatement(source);
        if (result.hasErrors()) {
            throw new UnhandledConstructException(
                    "Failed to parse: " + result.getErrorMessage(), source, "ANTLR parsing");
        }
        return new AstBuilder().visit(result.getTree());
    }

    private static BaseErrorListener collectingListener(List<String> errors) {
        return new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg,
                                    RecognitionException e) {
                String error = String.format("Line %d:%d - %s", line, charPositionInLine, msg);
                errors.add(error);
                log.debug("Parse error: {}", error);
            }
        };
    }
}
