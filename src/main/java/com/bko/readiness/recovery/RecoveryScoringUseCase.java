package com.bko.readiness.recovery;

import java.util.List;

public interface RecoveryScoringUseCase {
    /**
     * Scores today's readiness from the athlete's signals.
     *
     * @param today          today's readings
     * @param healthHistory  earlier daily readings, oldest first; entries on or after today's date are ignored
     * @param workoutHistory workouts of the last 28 days or more, oldest first
     * @return the component breakdown, the overall score when computable, and any anomalies
     */
    RecoveryAssessment assess(HealthSample today, List<HealthSample> healthHistory, List<WorkoutSample> workoutHistory);
}
