package me.christianrobert.polyglotconv.transformer.context;

/**
 * The converter met a node shape, operator or argument pattern it has no rewrite rule for.
 * Indicates a grammar gap; reported loudly.
 */
public class UnhandledConstructException extends ConversionException {

    public UnhandledConstructException(String message) {
        super(message);
    }

    public UnhandledConstructException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnhandledConstructException(String message, String source, String context) {
        super(message, source, context);
    }

    public UnhandledConstructException(String message, String source, String context, Throwable cause) {
        super(message, source, context, cause);
    }
}
