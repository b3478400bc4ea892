package me.christianrobert.polyglotconv.transformer.context;

/**
 * A recognised construct that the Java target deliberately does not support
 * (for example {@code r.row}). Expected, so not reported as an anomaly.
 */
public class SkippedConstructException extends ConversionException {

    public SkippedConstructException(String message) {
        super(message);
    }
}
