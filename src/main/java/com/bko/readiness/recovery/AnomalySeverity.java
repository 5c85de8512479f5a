package com.bko.readiness.recovery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalySeverity {
    NONE("none"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String label;

    AnomalySeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Returns the more severe of the two, so a critical finding is never downgraded.
     */
    public AnomalySeverity escalate(AnomalySeverity other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }

    @JsonCreator
    public static AnomalySeverity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return NONE;
        }
        String normalized = label.trim().toLowerCase(Locale.US);
        for (AnomalySeverity severity : values()) {
            if (severity.label.equals(normalized)) {
                return severity;
            }
        }
        // an unreadable severity is treated as a warning rather than ignored
        return WARNING;
    }

    @Override
    public String toString() {
        return label;
    }
}
