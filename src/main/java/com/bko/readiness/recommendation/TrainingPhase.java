package com.bko.readiness.recommendation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrainingPhase {
    BASE("base"),
    BUILD("build"),
    PEAK("peak"),
    TAPER("taper");

    private final String label;

    TrainingPhase(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static TrainingPhase fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String normalized = label.trim().toLowerCase(Locale.US);
        for (TrainingPhase phase : values()) {
            if (phase.label.equals(normalized)) {
                return phase;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
