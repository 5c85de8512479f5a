package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.AnomalyResult;
import com.bko.readiness.recovery.ComponentScores;
import com.bko.readiness.recovery.HealthSample;
import com.bko.readiness.recovery.InvalidMetricException;
import com.bko.readiness.recovery.RecoveryAssessment;
import com.bko.readiness.recovery.RecoveryScore;
import com.bko.readiness.recovery.RecoveryScoringUseCase;
import com.bko.readiness.recovery.RecoveryStatus;
import com.bko.readiness.recovery.WorkoutSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Service
public class RecoveryScoringService implements RecoveryScoringUseCase {
    private static final Logger logger = LoggerFactory.getLogger(RecoveryScoringService.class);

    private final HrvScorer hrvScorer;
    private final RestingHeartRateScorer restingHeartRateScorer;
    private final SleepScorer sleepScorer;
    private final AcwrScorer acwrScorer;
    private final RecoveryAggregator aggregator;
    private final AnomalyDetector anomalyDetector;
    private final RecoveryExplanationWriter explanationWriter;

    public RecoveryScoringService(HrvScorer hrvScorer,
                                  RestingHeartRateScorer restingHeartRateScorer,
                                  SleepScorer sleepScorer,
                                  AcwrScorer acwrScorer,
                                  RecoveryAggregator aggregator,
                                  AnomalyDetector anomalyDetector,
                                  RecoveryExplanationWriter explanationWriter) {
        this.hrvScorer = hrvScorer;
        this.restingHeartRateScorer = restingHeartRateScorer;
        this.sleepScorer = sleepScorer;
        this.acwrScorer = acwrScorer;
        this.aggregator = aggregator;
        this.anomalyDetector = anomalyDetector;
        this.explanationWriter = explanationWriter;
    }

    @Override
    public RecoveryAssessment assess(HealthSample today, List<HealthSample> healthHistory, List<WorkoutSample> workoutHistory) {
        if (today == null) {
            throw new InvalidMetricException("Today's health sample is required");
        }
        List<HealthSample> health = priorHealth(today, healthHistory);
        List<WorkoutSample> workouts = workoutsUpTo(today, workoutHistory);

        ComponentScores components = new ComponentScores(
                hrvScorer.score(today.hrvMs(), health),
                restingHeartRateScorer.score(today.restingHrValue(), health),
                sleepScorer.score(today),
                acwrScorer.score(workouts, today.date())
        );
        AnomalyResult anomalies = anomalyDetector.detect(today, health, components);

        Integer overall = aggregator.aggregate(components);
        if (overall == null) {
            logger.debug("No recovery score for {}: {} component(s) available", today.date(), components.presentCount());
            return new RecoveryAssessment(today.date(), components, null, anomalies);
        }

        RecoveryStatus status = RecoveryStatus.classify(overall, anomalies.severity());
        String explanation = explanationWriter.write(overall, components, anomalies);
        logger.info("Recovery score for {}: {} ({}), anomalies: {}", today.date(), overall, status, anomalies.severity());
        return new RecoveryAssessment(today.date(), components, new RecoveryScore(overall, status, components, explanation), anomalies);
    }

    private List<HealthSample> priorHealth(HealthSample today, List<HealthSample> history) {
        if (history == null) {
            return List.of();
        }
        return history.stream()
                .filter(Objects::nonNull)
                .filter(sample -> sample.date().isBefore(today.date()))
                .sorted(Comparator.comparing(HealthSample::date))
                .toList();
    }

    private List<WorkoutSample> workoutsUpTo(HealthSample today, List<WorkoutSample> history) {
        if (history == null) {
            return List.of();
        }
        return history.stream()
                .filter(Objects::nonNull)
                .filter(workout -> !workout.date().isAfter(today.date()))
                .sorted(Comparator.comparing(WorkoutSample::date))
                .toList();
    }
}
