package com.bko.readiness.recommendation;

import com.bko.readiness.recovery.TrainingIntensity;

public record AlternativeWorkout(
        TrainingIntensity intensity,
        String workoutType,
        int durationMinutes,
        WorkoutStructure structure,
        String rationale
) {
}
