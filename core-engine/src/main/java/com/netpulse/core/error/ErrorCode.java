package com.netpulse.core.error;

/**
 * Failure categories raised by the analytics core.
 *
 * <ul>
 * <li>{@link #INVALID_INPUT} is terminal and surfaced to the caller.</li>
 * <li>{@link #INSUFFICIENT_DATA}, {@link #INSUFFICIENT_TRAINING_DATA} and
 * {@link #NUMERIC_OVERFLOW} are recoverable: the orchestrator degrades the
 * affected output instead of propagating them.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum ErrorCode {

    /** Null or malformed metrics batch. */
    INVALID_INPUT,

    /** Too few samples for a statistic to be defined. */
    INSUFFICIENT_DATA,

    /** Too few samples to initialise a forecast model. */
    INSUFFICIENT_TRAINING_DATA,

    /** A statistic of finite samples does not fit in a {@code double}. */
    NUMERIC_OVERFLOW
}
