package com.bko.readiness.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

public record OvertrainingRisk(Level level, int recommendedRestDays) {
    public static final OvertrainingRisk NONE = new OvertrainingRisk(Level.NONE, 0);

    public enum Level {
        NONE("none", 0),
        LOW("low", 1),
        MEDIUM("medium", 2),
        HIGH("high", 3);

        private final String label;
        private final int restDays;

        Level(String label, int restDays) {
            this.label = label;
            this.restDays = restDays;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }

    public OvertrainingRisk {
        level = level == null ? Level.NONE : level;
    }

    public static OvertrainingRisk of(Level level) {
        return new OvertrainingRisk(level, level == null ? 0 : level.restDays);
    }
}
