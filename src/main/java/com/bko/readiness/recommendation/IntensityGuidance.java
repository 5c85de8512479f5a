package com.bko.readiness.recommendation;

import com.bko.readiness.recovery.TrainingIntensity;

import java.util.List;

/**
 * Training envelope for an intensity tier: heart-rate zones, a duration range, suitable session
 * types and the tiers the athlete could switch to.
 */
public record IntensityGuidance(
        TrainingIntensity intensity,
        List<Integer> zones,
        int minDurationMinutes,
        int maxDurationMinutes,
        List<String> workoutTypes,
        String rationale,
        List<String> warnings,
        List<TrainingIntensity> alternativeIntensities
) {
    public IntensityGuidance {
        zones = zones == null ? List.of() : List.copyOf(zones);
        workoutTypes = workoutTypes == null ? List.of() : List.copyOf(workoutTypes);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        alternativeIntensities = alternativeIntensities == null ? List.of() : List.copyOf(alternativeIntensities);
    }
}
