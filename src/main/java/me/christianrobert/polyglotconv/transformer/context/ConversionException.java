package me.christianrobert.polyglotconv.transformer.context;

/**
 * Base exception for expressions that cannot be converted to Java.
 * Captures the source line and where in the conversion the problem surfaced.
 *
 * <p>Never escapes an emitter invocation: {@code JavaCodeBuilder.convert} turns it into a
 * {@link ConversionResult}.</p>
 *
 * @see UnhandledConstructException
 * @see SkippedConstructException
 */
public abstract class ConversionException extends RuntimeException {

    private final String source;
    private final String context;

    protected ConversionException(String message) {
        super(message);
        this.source = null;
        this.context = null;
    }

    protected ConversionException(String message, Throwable cause) {
        super(message, cause);
        this.source = null;
        this.context = null;
    }

    protected ConversionException(String message, String source, String context) {
        super(message);
        this.source = source;
        this.context = context;
    }

    protected ConversionException(String message, String source, String context, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.context = context;
    }

    public String getSource() {
        return source;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including source line and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (source != null) {
            sb.append("\nSource: ").append(source);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
