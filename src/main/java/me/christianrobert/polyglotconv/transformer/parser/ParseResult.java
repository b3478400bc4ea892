package me.christianrobert.polyglotconv.transformer.parser;

import org.antlr.v4.runtime.ParserRuleContext;

import java.util.List;

/**
 * Outcome of parsing one host-language line: the statement tree and the syntax errors
 * reported while lexing and parsing it.
 *
 * <p>The tree is present even when there are errors (the LL stage recovers), but it is
 * only meaningful when {@link #isSuccess()}.</p>
 */
public class ParseResult {

    private final ParserRuleContext statement;
    private final List<String> syntaxErrors;
    private final String source;

    public ParseResult(ParserRuleContext statement, List<String> syntaxErrors, String source) {
        this.statement = statement;
        this.syntaxErrors = List.copyOf(syntaxErrors);
        this.source = source;
    }

    public ParserRuleContext getTree() {
        return statement;
    }

    /**
     * Syntax errors as {@code "Line <line>:<column> - <message>"}, in reporting order.
     */
    public List<String> getErrors() {
        return syntaxErrors;
    }

    public String getSource() {
        return source;
    }

    public boolean isSuccess() {
        return syntaxErrors.isEmpty();
    }

    public boolean hasErrors() {
        return !isSuccess();
    }

    /**
     * All syntax errors, one per line, or null when parsing succeeded.
     */
    public String getErrorMessage() {
        return isSuccess() ? null : String.join("\n", syntaxErrors);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ParseResult[ok: " + source + "]"
                : "ParseResult[" + syntaxErrors.size() + " error(s): " + source + "]";
    }
}
