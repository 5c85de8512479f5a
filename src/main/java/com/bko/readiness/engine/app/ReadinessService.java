package com.bko.readiness.engine.app;

import com.bko.readiness.engine.ReadinessReport;
import com.bko.readiness.engine.ReadinessRequest;
import com.bko.readiness.engine.ReadinessUseCase;
import com.bko.readiness.recommendation.RecommendationRequest;
import com.bko.readiness.recommendation.RecommendationResult;
import com.bko.readiness.recommendation.RecommendationUseCase;
import com.bko.readiness.recovery.ComponentScores;
import com.bko.readiness.recovery.RecoveryAssessment;
import com.bko.readiness.recovery.RecoveryScoringUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ReadinessService implements ReadinessUseCase {
    private static final Logger logger = LoggerFactory.getLogger(ReadinessService.class);
    private static final int COMPONENT_COUNT = 4;

    private final RecoveryScoringUseCase recoveryScoringUseCase;
    private final RecommendationUseCase recommendationUseCase;

    public ReadinessService(RecoveryScoringUseCase recoveryScoringUseCase, RecommendationUseCase recommendationUseCase) {
        this.recoveryScoringUseCase = recoveryScoringUseCase;
        this.recommendationUseCase = recommendationUseCase;
    }

    @Override
    public ReadinessReport evaluate(ReadinessRequest request) {
        ReportNotes notes = new ReportNotes();
        RecoveryAssessment assessment = recoveryScoringUseCase.assess(request.today(), request.healthHistory(),
                request.workoutHistory());
        noteMissingData(notes, assessment);

        RecommendationResult result = recommendationUseCase.recommend(new RecommendationRequest(
                assessment.date(),
                assessment.score(),
                assessment.anomalies(),
                request.workoutHistory(),
                request.recoveryHistory(),
                request.constraints()));
        if (result.isDowngraded()) {
            notes.warn("Intensity reduced to " + result.primary().intensity() + " to prevent overtraining.");
        }

        logger.info("Readiness for {}: score {}, recommended {} {}", assessment.date(),
                assessment.hasScore() ? assessment.score().overallScore() : "n/a",
                result.primary().intensity(), result.primary().workoutType());
        return new ReadinessReport(assessment.date(), assessment, result.primary(), result.alternatives(),
                result.guidance(), result.overtrainingRisk(), notes.getMessages());
    }

    private void noteMissingData(ReportNotes notes, RecoveryAssessment assessment) {
        ComponentScores components = assessment.components();
        if (!assessment.hasScore()) {
            notes.info("Insufficient data for a recovery score: " + components.presentCount() + " of "
                    + COMPONENT_COUNT + " components available, at least 2 needed. Defaulting to rest.");
        }
        if (components.hrvScore() == null) {
            notes.info("HRV not scored: today's reading or 4 days of HRV history is missing.");
        }
        if (components.hrScore() == null) {
            notes.info("Resting HR not scored: today's reading or 4 days of resting HR history is missing.");
        }
        if (components.sleepScore() == null) {
            notes.info("Sleep not scored: no sleep duration recorded for last night.");
        }
        if (components.acwrScore() == null) {
            notes.info("Training load not scored: 28 days of workout history are needed.");
        }
    }
}
