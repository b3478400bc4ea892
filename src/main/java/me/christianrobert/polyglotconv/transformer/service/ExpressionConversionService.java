package me.christianrobert.polyglotconv.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.polyglotconv.config.service.ConfigService;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.builder.EmissionMode;
import me.christianrobert.polyglotconv.transformer.builder.JavaCodeBuilder;
import me.christianrobert.polyglotconv.transformer.context.ConversionContext;
import me.christianrobert.polyglotconv.transformer.context.ConversionResult;
import me.christianrobert.polyglotconv.transformer.context.ReqlVariables;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import me.christianrobert.polyglotconv.transformer.parser.AntlrParser;
import me.christianrobert.polyglotconv.transformer.type.SimpleTermTypeEvaluator;
import me.christianrobert.polyglotconv.transformer.util.ExpressionTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * High-level service for converting host-language expressions to Java.
 * This is the entry point used by the test file converter.
 *
 * <p>Architecture:
 * <pre>
 * source line → ANTLR parse → AstBuilder → classify → JavaCodeBuilder → Java source
 *                  ↓              ↓            ↓              ↓
 *           PyExpressionParser  ExpressionNode  TermType   ConversionResult
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * ConversionResult result = service.convert("t.filter(lambda x: x['a'] > 1)", ReqlVariables.of("r", "t"));
 * if (result.isSuccess()) {
 *     String java = result.getJavaCode();
 * } else {
 *     // result.getReason(), result.isSkipped()
 * }
 * </pre>
 *
 * <p>Hard failures are logged at warn level together with a dump of the expression tree;
 * skipped constructs only at debug level.</p>
 */
@ApplicationScoped
public class ExpressionConversionService {

    private static final Logger log = LoggerFactory.getLogger(ExpressionConversionService.class);

    @Inject
    AntlrParser parser;

    @Inject
    ConfigService configService;

    /**
     * Initial ReQL variables of a test file: the ReQL root plus the file's table variables.
     */
    public ReqlVariables initialVariables(Collection<String> tableVariableNames) {
        return ReqlVariables.of(configService.getReqlRootName()).withAll(tableVariableNames);
    }

    /**
     * Creates a conversion context with the configured Java declaration types.
     */
    public ConversionContext createContext(ReqlVariables reqlVariables) {
        return new ConversionContext(
                reqlVariables,
                new SimpleTermTypeEvaluator(reqlVariables),
                configService.getReqlTermType(),
                configService.getOpaqueType());
    }

    /**
     * Parses a source line into an expression tree.
     *
     * @throws UnhandledConstructException if the line is not in the supported grammar
     */
    public ExpressionNode parseTerm(String line) {
        return parser.parseExpression(line);
    }

    /**
     * Whether {@code node} evaluates to a ReQL term, given the known ReQL variables.
     */
    public boolean isReql(ExpressionNode node, ReqlVariables reqlVariables) {
        return createContext(reqlVariables).isReql(node);
    }

    /**
     * Converts a source line, choosing the emission mode by classifying the expression.
     *
     * @param source Host-language source line
     * @param reqlVariables Variables known to hold ReQL terms
     * @return ConversionResult containing either Java source or the reason it was not converted
     */
    public ConversionResult convert(String source, ReqlVariables reqlVariables) {
        return convert(source, reqlVariables, null);
    }

    /**
     * Converts a source line in the given emission mode.
     *
     * @param mode Emission mode, or null to classify the expression
     */
    public ConversionResult convert(String source, ReqlVariables reqlVariables, EmissionMode mode) {
        if (source == null || source.trim().isEmpty()) {
            return ConversionResult.unhandled("Source cannot be null or empty");
        }

        ExpressionNode node;
        try {
            log.trace("Parsing: {}", source);
            node = parseTerm(source);
        } catch (UnhandledConstructException e) {
            log.warn("Parse failed: {}", e.getDetailedMessage());
            return ConversionResult.unhandled(e.getMessage());
        }
        return convert(node, source, reqlVariables, mode);
    }

    /**
     * Converts an already parsed expression.
     *
     * @param node Expression tree
     * @param source Source line the tree was parsed from (for diagnostics)
     * @param reqlVariables Variables known to hold ReQL terms
     * @param mode Emission mode, or null to classify the expression
     */
    public ConversionResult convert(ExpressionNode node, String source, ReqlVariables reqlVariables,
                                    EmissionMode mode) {
        ConversionContext context = createContext(reqlVariables);
        JavaCodeBuilder builder = mode != null
                ? new JavaCodeBuilder(context, mode)
                : JavaCodeBuilder.forTerm(context, node);

        log.debug("Converting in {} mode: {}", builder.getMode().getName(), source);

        ConversionResult result;
        try {
            result = builder.convert(node);
        } catch (RuntimeException e) {
            log.error("Unexpected error while translating: {}", source, e);
            return ConversionResult.unhandled("Unexpected error: " + e.getMessage());
        }

        if (result.isUnhandled()) {
            log.warn("While translating: {}\n{}\nGot unhandled construct: {}",
                    source, ExpressionTreeFormatter.format(node), result.getReason());
        } else if (result.isSkipped()) {
            log.debug("Skipped {}: {}", source, result.getReason());
        } else {
            log.trace("Java: {}", result.getJavaCode());
        }
        return result;
    }
}
