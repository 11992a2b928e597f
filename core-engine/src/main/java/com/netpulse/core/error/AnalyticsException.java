package com.netpulse.core.error;

import java.util.Objects;

/**
 * Unchecked exception thrown by the analytics components.
 *
 * <p>
 * Every instance carries an {@link ErrorCode} so callers can tell terminal
 * input errors apart from the recoverable "not enough samples" and overflow
 * conditions.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    /**
     * @param errorCode failure category; must not be {@code null}
     * @param message   human-readable detail
     */
    public AnalyticsException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    /**
     * @param errorCode failure category; must not be {@code null}
     * @param message   human-readable detail
     * @param cause     underlying failure
     */
    public AnalyticsException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public static AnalyticsException invalidInput(String message) {
        return new AnalyticsException(ErrorCode.INVALID_INPUT, message);
    }

    public static AnalyticsException insufficientData(int required, int actual) {
        return new AnalyticsException(ErrorCode.INSUFFICIENT_DATA,
                "At least " + required + " samples required, got: " + actual);
    }

    public static AnalyticsException insufficientTrainingData(int required, int actual) {
        return new AnalyticsException(ErrorCode.INSUFFICIENT_TRAINING_DATA,
                "At least " + required + " training samples required, got: " + actual);
    }

    public static AnalyticsException numericOverflow(String quantity) {
        return new AnalyticsException(ErrorCode.NUMERIC_OVERFLOW,
                "Sample " + quantity + " exceeds the double range");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return {@code true} for every category except {@code INVALID_INPUT};
     *         callers are expected to degrade on these
     */
    public boolean isRecoverable() {
        return errorCode != ErrorCode.INVALID_INPUT;
    }
}
