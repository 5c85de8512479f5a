package com.bko.readiness.engine;

import com.bko.readiness.recommendation.TrainingConstraints;
import com.bko.readiness.recovery.HealthSample;
import com.bko.readiness.recovery.InvalidMetricException;
import com.bko.readiness.recovery.RecoveryScore;
import com.bko.readiness.recovery.WorkoutSample;

import java.util.List;

/**
 * One engine call: today's readings plus history. Health history should cover at least seven days
 * and workout history at least 28 for every component to be scored; shorter histories degrade
 * gracefully.
 */
public record ReadinessRequest(
        HealthSample today,
        List<HealthSample> healthHistory,
        List<WorkoutSample> workoutHistory,
        List<RecoveryScore> recoveryHistory,
        TrainingConstraints constraints
) {
    public ReadinessRequest {
        if (today == null) {
            throw new InvalidMetricException("Readiness request is missing today's health sample");
        }
        healthHistory = copyOf(healthHistory, "health history");
        workoutHistory = copyOf(workoutHistory, "workout history");
        recoveryHistory = copyOf(recoveryHistory, "recovery history");
        constraints = constraints == null ? TrainingConstraints.NONE : constraints;
    }

    public static ReadinessRequest of(HealthSample today, List<HealthSample> healthHistory, List<WorkoutSample> workoutHistory) {
        return new ReadinessRequest(today, healthHistory, workoutHistory, List.of(), TrainingConstraints.NONE);
    }

    private static <T> List<T> copyOf(List<T> values, String name) {
        if (values == null) {
            return List.of();
        }
        for (T value : values) {
            if (value == null) {
                throw new InvalidMetricException("Readiness request has an empty entry in its " + name);
            }
        }
        return List.copyOf(values);
    }
}
