package me.christianrobert.polyglotconv.transformer.context;

import java.util.Objects;

/**
 * Result of converting one expression.
 * Contains either the Java source text or the reason the expression was not converted.
 *
 * <p>Two failure kinds are distinguished:
 * <ul>
 *   <li>{@link Status#UNHANDLED} - no rewrite rule exists (grammar gap, logged as a warning)</li>
 *   <li>{@link Status#SKIPPED} - construct intentionally not supported for Java (silent)</li>
 * </ul>
 */
public class ConversionResult {

    public enum Status {
        SUCCESS,
        UNHANDLED,
        SKIPPED
    }

    private final Status status;
    private final String javaCode;
    private final String reason;

    private ConversionResult(Status status, String javaCode, String reason) {
        this.status = status;
        this.javaCode = javaCode;
        this.reason = reason;
    }

    public static ConversionResult success(String javaCode) {
        return new ConversionResult(Status.SUCCESS, Objects.requireNonNull(javaCode, "javaCode"), null);
    }

    public static ConversionResult unhandled(String reason) {
        return new ConversionResult(Status.UNHANDLED, null, reason);
    }

    public static ConversionResult skipped(String reason) {
        return new ConversionResult(Status.SKIPPED, null, reason);
    }

    /**
     * Creates a failed result from an exception, keeping its kind.
     */
    public static ConversionResult failure(ConversionException exception) {
        if (exception instanceof SkippedConstructException) {
            return skipped(exception.getMessage());
        }
        return unhandled(exception.getMessage());
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailure() {
        return status != Status.SUCCESS;
    }

    public boolean isUnhandled() {
        return status == Status.UNHANDLED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public String getJavaCode() {
        return javaCode;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Same failure with a prefix added to the reason (e.g. which run option failed).
     * Successful results are returned unchanged.
     */
    public ConversionResult withReasonPrefix(String prefix) {
        if (isSuccess()) {
            return this;
        }
        return new ConversionResult(status, null, prefix + reason);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "ConversionResult{success=true, javaCode='" + javaCode + "'}";
        }
        return "ConversionResult{status=" + status + ", reason='" + reason + "'}";
    }
}
