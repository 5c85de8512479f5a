package com.bko.readiness.recovery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecoveryStatus {
    GREEN("green"),
    YELLOW("yellow"),
    RED("red");

    public static final int GREEN_THRESHOLD = 70;
    public static final int YELLOW_THRESHOLD = 40;

    private final String label;

    RecoveryStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Colors a score. A critical anomaly always means red; a warning keeps a high score out of green.
     */
    public static RecoveryStatus classify(int overallScore, AnomalySeverity severity) {
        if (severity == AnomalySeverity.CRITICAL) {
            return RED;
        }
        if (overallScore >= GREEN_THRESHOLD) {
            return severity == AnomalySeverity.WARNING ? YELLOW : GREEN;
        }
        if (overallScore >= YELLOW_THRESHOLD) {
            return YELLOW;
        }
        return RED;
    }

    @JsonCreator
    public static RecoveryStatus fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String normalized = label.trim().toLowerCase(Locale.US);
        for (RecoveryStatus status : values()) {
            if (status.label.equals(normalized)) {
                return status;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
