package com.bko.readiness.recovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkoutSample(
        LocalDate date,
        String workoutType,
        TrainingIntensity intensity,
        Double trainingStressScore
) {
    public WorkoutSample {
        if (date == null) {
            throw new InvalidMetricException("Workout is missing its date");
        }
        if (workoutType == null || workoutType.isBlank()) {
            throw new InvalidMetricException("Workout on " + date + " has no type");
        }
        if (intensity == null) {
            throw new InvalidMetricException("Workout on " + date + " has no intensity");
        }
        if (trainingStressScore != null
                && (trainingStressScore.isNaN() || trainingStressScore.isInfinite() || trainingStressScore < 0)) {
            throw new InvalidMetricException("Training stress must be a non-negative number, got "
                    + trainingStressScore + " on " + date);
        }
        workoutType = workoutType.trim();
    }

    public boolean isHard() {
        return intensity == TrainingIntensity.HARD;
    }

    public boolean isRace() {
        return workoutType.toLowerCase(Locale.US).contains("race");
    }

    public double loadOrZero() {
        return trainingStressScore == null ? 0.0 : trainingStressScore;
    }
}
