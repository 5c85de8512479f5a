package com.bko.readiness.recommendation;

import com.bko.readiness.recovery.TrainingIntensity;

import java.util.List;

public record WorkoutRecommendation(
        TrainingIntensity intensity,
        String workoutType,
        int durationMinutes,
        WorkoutStructure structure,
        String rationale,
        List<String> warnings
) {
    public WorkoutRecommendation {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
