package com.bko.readiness.engine.app;

import com.bko.readiness.engine.ReadinessReport;
import com.bko.readiness.engine.ReadinessRequest;
import com.bko.readiness.recommendation.RecommendationRequest;
import com.bko.readiness.recommendation.RecommendationResult;
import com.bko.readiness.recommendation.RecommendationUseCase;
import com.bko.readiness.recommendation.TrainingConstraints;
import com.bko.readiness.recommendation.WorkoutRecommendation;
import com.bko.readiness.recommendation.WorkoutStructure;
import com.bko.readiness.recovery.AnomalyResult;
import com.bko.readiness.recovery.AnomalySeverity;
import com.bko.readiness.recovery.ComponentScores;
import com.bko.readiness.recovery.HealthSample;
import com.bko.readiness.recovery.RecoveryAssessment;
import com.bko.readiness.recovery.RecoveryScore;
import com.bko.readiness.recovery.RecoveryScoringUseCase;
import com.bko.readiness.recovery.RecoveryStatus;
import com.bko.readiness.recovery.TrainingIntensity;
import com.bko.readiness.recovery.WorkoutSample;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReadinessServiceTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 28);

    private final RecoveryScoringUseCase recoveryScoringUseCase = mock(RecoveryScoringUseCase.class);
    private final RecommendationUseCase recommendationUseCase = mock(RecommendationUseCase.class);
    private final ReadinessService service = new ReadinessService(recoveryScoringUseCase, recommendationUseCase);

    @Test
    void passesAssessmentToRecommender() {
        HealthSample today = HealthSample.of(TODAY, 62.0, 49);
        List<HealthSample> health = List.of(HealthSample.of(TODAY.minusDays(1), 60.0, 50));
        List<WorkoutSample> workouts = List.of(new WorkoutSample(TODAY.minusDays(1), "tempo", TrainingIntensity.MODERATE, 70.0));
        List<RecoveryScore> scores = List.of(RecoveryScore.of(70, RecoveryStatus.GREEN));
        TrainingConstraints constraints = TrainingConstraints.forSport("cycling");
        RecoveryScore score = new RecoveryScore(88, RecoveryStatus.GREEN, new ComponentScores(90, 85, 80, 95), "Good");
        RecoveryAssessment assessment = new RecoveryAssessment(TODAY, score.components(), score, AnomalyResult.NONE);

        when(recoveryScoringUseCase.assess(today, health, workouts)).thenReturn(assessment);
        RecommendationResult result = result(TrainingIntensity.HARD, List.of(), null);
        when(recommendationUseCase.recommend(any())).thenReturn(result);

        ReadinessReport report = service.evaluate(new ReadinessRequest(today, health, workouts, scores, constraints));

        ArgumentCaptor<RecommendationRequest> captor = ArgumentCaptor.forClass(RecommendationRequest.class);
        verify(recommendationUseCase).recommend(captor.capture());
        RecommendationRequest request = captor.getValue();
        assertEquals(TODAY, request.date());
        assertSame(score, request.score());
        assertEquals(workouts, request.recentWorkouts());
        assertEquals(scores, request.recoveryHistory());
        assertEquals(constraints, request.constraints());

        assertTrue(report.hasScore());
        assertSame(assessment, report.assessment());
        assertSame(result.primary(), report.recommendation());
        assertTrue(report.messages().isEmpty());
    }

    @Test
    void notesInsufficientData() {
        HealthSample today = new HealthSample(TODAY, null, null, 7 * 3600L, null);
        RecoveryAssessment assessment = new RecoveryAssessment(TODAY, new ComponentScores(null, null, 85, null), null,
                AnomalyResult.NONE);
        when(recoveryScoringUseCase.assess(any(), any(), any())).thenReturn(assessment);
        when(recommendationUseCase.recommend(any())).thenReturn(result(TrainingIntensity.REST, List.of(), null));

        ReadinessReport report = service.evaluate(ReadinessRequest.of(today, List.of(), List.of()));

        assertFalse(report.hasScore());
        assertEquals("Insufficient data for a recovery score: 1 of 4 components available, at least 2 needed. "
                + "Defaulting to rest.", report.messages().get(0));
        assertEquals(4, report.messages().size());
        assertTrue(report.messages().get(1).startsWith("HRV not scored"));
        assertTrue(report.messages().get(3).startsWith("Training load not scored"));
    }

    @Test
    void warnsWhenIntensityWasReduced() {
        AnomalyResult anomalies = new AnomalyResult(true, AnomalySeverity.WARNING, List.of("HRV below normal."), List.of());
        RecoveryScore score = new RecoveryScore(80, RecoveryStatus.YELLOW, new ComponentScores(60, 90, 90, 90), "");
        when(recoveryScoringUseCase.assess(any(), any(), any()))
                .thenReturn(new RecoveryAssessment(TODAY, score.components(), score, anomalies));
        String downgrade = "Overtraining Prevention: You've completed 3 consecutive hard training days.";
        when(recommendationUseCase.recommend(any())).thenReturn(result(TrainingIntensity.MODERATE,
                List.of(downgrade, "HRV below normal."), downgrade));

        ReadinessReport report = service.evaluate(ReadinessRequest.of(HealthSample.of(TODAY, 55.0, 50), List.of(), List.of()));

        assertEquals(List.of("WARN: Intensity reduced to moderate to prevent overtraining."), report.messages());
    }

    @Test
    void extraWarningsWithoutDowngradeAddNoNote() {
        RecoveryScore score = new RecoveryScore(75, RecoveryStatus.GREEN, new ComponentScores(80, 80, 70, 70), "");
        when(recoveryScoringUseCase.assess(any(), any(), any()))
                .thenReturn(new RecoveryAssessment(TODAY, score.components(), score, AnomalyResult.NONE));
        when(recommendationUseCase.recommend(any())).thenReturn(result(TrainingIntensity.MODERATE,
                List.of("Heads up: long day tomorrow."), null));

        ReadinessReport report = service.evaluate(ReadinessRequest.of(HealthSample.of(TODAY, 60.0, 50), List.of(), List.of()));

        assertTrue(report.messages().isEmpty());
    }

    private static RecommendationResult result(TrainingIntensity intensity, List<String> warnings, String downgrade) {
        WorkoutStructure structure = WorkoutStructure.steady(60);
        WorkoutRecommendation primary = new WorkoutRecommendation(intensity, "steady", 60, structure, "Because.", warnings);
        return new RecommendationResult(primary, List.of(), null, null, downgrade);
    }
}
