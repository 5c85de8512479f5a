package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.HealthSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores last night's sleep from its duration and, when the device reports one, its quality score.
 */
@Component
public class SleepScorer {
    private static final Logger logger = LoggerFactory.getLogger(SleepScorer.class);
    private static final double DURATION_WEIGHT = 0.6;
    private static final double QUALITY_WEIGHT = 0.4;
    private static final double LONG_SLEEP_HOURS = 10.0;
    private static final double LONG_SLEEP_SCORE = 70.0;
    private static final double LONG_SLEEP_PENALTY_PER_TWO_HOURS = 20.0;
    private static final ReferenceCurve DURATION_CURVE = ReferenceCurve.of(
            4, 0,
            5, 40,
            6, 70,
            7, 100,
            9, 100,
            10, 70
    );

    public Integer score(HealthSample sample) {
        if (sample == null) {
            logger.debug("No sleep data for today");
            return null;
        }
        return score(sample.sleepDurationSeconds(), sample.sleepQualityScore());
    }

    public Integer score(Long durationSeconds, Integer qualityScore) {
        if (durationSeconds == null) {
            logger.debug("No sleep duration for today");
            return null;
        }
        if (durationSeconds < 0) {
            logger.warn("Ignoring negative sleep duration {}s", durationSeconds);
            return null;
        }
        double hours = durationSeconds / 3600.0;
        int durationScore = durationScore(hours);
        if (qualityScore == null) {
            logger.debug("Sleep {}h -> {} (no quality score)", String.format("%.1f", hours), durationScore);
            return durationScore;
        }
        int quality = Math.max(0, Math.min(100, qualityScore));
        double combined = durationScore * DURATION_WEIGHT + quality * QUALITY_WEIGHT;
        int score = ReferenceCurve.round(combined);
        logger.debug("Sleep {}h (duration score {}) with quality {} -> {}",
                String.format("%.1f", hours), durationScore, quality, score);
        return score;
    }

    int durationScore(double hours) {
        if (hours > LONG_SLEEP_HOURS) {
            // keeps declining past ten hours: 12h scores 50, 14h 30, 17h or more 0
            double penalty = (hours - LONG_SLEEP_HOURS) / 2.0 * LONG_SLEEP_PENALTY_PER_TWO_HOURS;
            return ReferenceCurve.round(Math.max(0.0, LONG_SLEEP_SCORE - penalty));
        }
        return DURATION_CURVE.scoreAt(hours);
    }
}
