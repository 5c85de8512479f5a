package com.bko.readiness.recovery;

public record RecoveryScore(
        int overallScore,
        RecoveryStatus status,
        ComponentScores components,
        String explanation
) {
    public RecoveryScore {
        if (overallScore < 0 || overallScore > 100) {
            throw new InvalidMetricException("Overall recovery score must be within 0-100, got " + overallScore);
        }
        if (status == null) {
            throw new InvalidMetricException("Recovery score " + overallScore + " has no status");
        }
        if (components == null) {
            components = ComponentScores.EMPTY;
        }
        if (explanation == null) {
            explanation = "";
        }
    }

    public static RecoveryScore of(int overallScore, RecoveryStatus status) {
        return new RecoveryScore(overallScore, status, ComponentScores.EMPTY, "");
    }
}
