package com.bko.readiness.recovery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrainingIntensity {
    HARD("hard"),
    MODERATE("moderate"),
    REST("rest"),
    RECOVERY("recovery");

    private final String label;

    TrainingIntensity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * True for the two tiers that mean no structured training: rest and its recovery variant.
     */
    public boolean isRestTier() {
        return this == REST || this == RECOVERY;
    }

    @JsonCreator
    public static TrainingIntensity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String normalized = label.trim().toLowerCase(Locale.US);
        for (TrainingIntensity intensity : values()) {
            if (intensity.label.equals(normalized)) {
                return intensity;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
