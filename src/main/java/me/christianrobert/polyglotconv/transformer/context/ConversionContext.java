package me.christianrobert.polyglotconv.transformer.context;

import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.type.SimpleTermTypeEvaluator;
import me.christianrobert.polyglotconv.transformer.type.TermTypeEvaluator;

import java.util.Objects;

/**
 * Read-only context shared by the builders of one conversion.
 *
 * <p>Holds the snapshot of known ReQL variables, the term type evaluator built on it,
 * and the Java type names used for variable declarations.</p>
 */
public class ConversionContext {

    public static final String DEFAULT_REQL_TERM_TYPE = "ReqlAst";
    public static final String DEFAULT_OPAQUE_TYPE = "Object";

    private final ReqlVariables reqlVariables;
    private final TermTypeEvaluator typeEvaluator;
    private final String reqlTermType;
    private final String opaqueType;

    public ConversionContext(ReqlVariables reqlVariables, TermTypeEvaluator typeEvaluator,
                             String reqlTermType, String opaqueType) {
        this.reqlVariables = Objects.requireNonNull(reqlVariables, "reqlVariables");
        this.typeEvaluator = Objects.requireNonNull(typeEvaluator, "typeEvaluator");
        this.reqlTermType = Objects.requireNonNull(reqlTermType, "reqlTermType");
        this.opaqueType = Objects.requireNonNull(opaqueType, "opaqueType");
    }

    public ConversionContext(ReqlVariables reqlVariables, String reqlTermType, String opaqueType) {
        this(reqlVariables, new SimpleTermTypeEvaluator(reqlVariables), reqlTermType, opaqueType);
    }

    /**
     * Creates a context with the default declaration types ({@code ReqlAst} / {@code Object}).
     */
    public ConversionContext(ReqlVariables reqlVariables) {
        this(reqlVariables, DEFAULT_REQL_TERM_TYPE, DEFAULT_OPAQUE_TYPE);
    }

    public ReqlVariables getReqlVariables() {
        return reqlVariables;
    }

    public TermTypeEvaluator getTypeEvaluator() {
        return typeEvaluator;
    }

    public boolean isReql(ExpressionNode node) {
        return typeEvaluator.isReql(node);
    }

    /**
     * Declared type of variables bound to ReQL terms.
     */
    public String getReqlTermType() {
        return reqlTermType;
    }

    /**
     * Declared type of variables bound to plain values.
     */
    public String getOpaqueType() {
        return opaqueType;
    }
}
