package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.HealthSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scores heart-rate variability against its seven-day baseline. Higher than usual is better:
 * +10% or more scores 100, on baseline 50, -10% 25 and -20% or lower 0.
 */
@Component
public class HrvScorer {
    private static final Logger logger = LoggerFactory.getLogger(HrvScorer.class);
    private static final ReferenceCurve CURVE = ReferenceCurve.of(
            -20, 0,
            -10, 25,
            0, 50,
            10, 100
    );

    public Integer score(Double todayHrv, List<HealthSample> history) {
        if (todayHrv == null) {
            logger.debug("No HRV reading for today");
            return null;
        }
        Double baseline = RollingBaseline.average(history, HealthSample::hrvMs);
        if (baseline == null || baseline == 0) {
            logger.debug("Not enough HRV history for a baseline");
            return null;
        }
        double deviation = RollingBaseline.deviationPercent(todayHrv, baseline);
        int score = CURVE.scoreAt(deviation);
        logger.debug("HRV {}ms vs baseline {}ms ({}%) -> {}", todayHrv,
                String.format("%.1f", baseline), String.format("%.1f", deviation), score);
        return score;
    }
}
