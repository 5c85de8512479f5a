package com.bko.readiness.engine;

import com.bko.readiness.recommendation.AlternativeWorkout;
import com.bko.readiness.recommendation.IntensityGuidance;
import com.bko.readiness.recommendation.OvertrainingRisk;
import com.bko.readiness.recommendation.WorkoutRecommendation;
import com.bko.readiness.recovery.RecoveryAssessment;

import java.time.LocalDate;
import java.util.List;

public record ReadinessReport(
        LocalDate date,
        RecoveryAssessment assessment,
        WorkoutRecommendation recommendation,
        List<AlternativeWorkout> alternatives,
        IntensityGuidance guidance,
        OvertrainingRisk overtrainingRisk,
        List<String> messages
) {
    public ReadinessReport {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public boolean hasScore() {
        return assessment != null && assessment.hasScore();
    }
}
