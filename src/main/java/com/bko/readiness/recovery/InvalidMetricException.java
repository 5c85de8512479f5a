package com.bko.readiness.recovery;

/**
 * Raised when a sample carries a value no sensor can produce, such as a negative sleep duration.
 * Distinct from insufficient data, which is reported as an absent score.
 */
public class InvalidMetricException extends IllegalArgumentException {

    public InvalidMetricException(String message) {
        super(message);
    }
}
