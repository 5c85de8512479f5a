package com.bko.readiness.recommendation;

import com.bko.readiness.recovery.AnomalyResult;
import com.bko.readiness.recovery.InvalidMetricException;
import com.bko.readiness.recovery.RecoveryScore;
import com.bko.readiness.recovery.WorkoutSample;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything the recommender looks at for one day. {@code score} is {@code null} when the day had
 * too little data to be scored; {@code recoveryHistory} holds earlier daily scores, oldest first.
 */
public record RecommendationRequest(
        LocalDate date,
        RecoveryScore score,
        AnomalyResult anomalies,
        List<WorkoutSample> recentWorkouts,
        List<RecoveryScore> recoveryHistory,
        TrainingConstraints constraints
) {
    public RecommendationRequest {
        if (date == null) {
            throw new InvalidMetricException("Recommendation request is missing its date");
        }
        anomalies = anomalies == null ? AnomalyResult.NONE : anomalies;
        recentWorkouts = copyOf(recentWorkouts, "recent workouts");
        recoveryHistory = copyOf(recoveryHistory, "recovery history");
        constraints = constraints == null ? TrainingConstraints.NONE : constraints;
    }

    public Integer overallScore() {
        return score == null ? null : score.overallScore();
    }

    private static <T> List<T> copyOf(List<T> values, String name) {
        if (values == null) {
            return List.of();
        }
        for (T value : values) {
            if (value == null) {
                throw new InvalidMetricException("Recommendation request has an empty entry in its " + name);
            }
        }
        return List.copyOf(values);
    }
}
