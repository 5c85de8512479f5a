package com.bko.readiness.recommendation;

import java.util.List;

/**
 * The primary session with its alternatives and guidance. {@code overtrainingWarning} is set when
 * overtraining prevention lowered the intensity the recovery score called for.
 */
public record RecommendationResult(
        WorkoutRecommendation primary,
        List<AlternativeWorkout> alternatives,
        IntensityGuidance guidance,
        OvertrainingRisk overtrainingRisk,
        String overtrainingWarning
) {
    public RecommendationResult {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        overtrainingRisk = overtrainingRisk == null ? OvertrainingRisk.NONE : overtrainingRisk;
    }

    public boolean isDowngraded() {
        return overtrainingWarning != null;
    }
}
