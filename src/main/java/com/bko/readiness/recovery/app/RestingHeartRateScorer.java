package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.HealthSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scores resting heart rate against its seven-day baseline. Lower than usual is better:
 * -5% or more below scores 100, on baseline 50, +5% 25 and +10% or higher 0.
 */
@Component
public class RestingHeartRateScorer {
    private static final Logger logger = LoggerFactory.getLogger(RestingHeartRateScorer.class);
    private static final ReferenceCurve CURVE = ReferenceCurve.of(
            -5, 100,
            0, 50,
            5, 25,
            10, 0
    );

    public Integer score(Double todayRestingHr, List<HealthSample> history) {
        if (todayRestingHr == null) {
            logger.debug("No resting HR reading for today");
            return null;
        }
        Double baseline = RollingBaseline.average(history, HealthSample::restingHrValue);
        if (baseline == null || baseline == 0) {
            logger.debug("Not enough resting HR history for a baseline");
            return null;
        }
        double deviation = RollingBaseline.deviationPercent(todayRestingHr, baseline);
        int score = CURVE.scoreAt(deviation);
        logger.debug("Resting HR {}bpm vs baseline {}bpm ({}%) -> {}", todayRestingHr,
                String.format("%.1f", baseline), String.format("%.1f", deviation), score);
        return score;
    }
}
