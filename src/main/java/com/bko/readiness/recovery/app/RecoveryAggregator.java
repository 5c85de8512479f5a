package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.ComponentScores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Combines component scores into the overall 0-100 score. Missing components hand their weight to
 * the present ones in proportion to their own weights; fewer than two present gives no score.
 */
@Component
public class RecoveryAggregator {
    private static final Logger logger = LoggerFactory.getLogger(RecoveryAggregator.class);
    public static final int MIN_COMPONENTS_REQUIRED = 2;

    enum Weight {
        HRV(0.40, ComponentScores::hrvScore),
        RESTING_HR(0.30, ComponentScores::hrScore),
        SLEEP(0.20, ComponentScores::sleepScore),
        ACWR(0.10, ComponentScores::acwrScore);

        private final double value;
        private final Function<ComponentScores, Integer> component;

        Weight(double value, Function<ComponentScores, Integer> component) {
            this.value = value;
            this.component = component;
        }

        double value() {
            return value;
        }

        Integer scoreIn(ComponentScores scores) {
            return component.apply(scores);
        }
    }

    public Integer aggregate(ComponentScores components) {
        if (components == null || components.presentCount() < MIN_COMPONENTS_REQUIRED) {
            logger.debug("Insufficient components for a recovery score: {} of {}",
                    components == null ? 0 : components.presentCount(), MIN_COMPONENTS_REQUIRED);
            return null;
        }

        double totalWeight = 0.0;
        for (Weight weight : Weight.values()) {
            if (weight.scoreIn(components) != null) {
                totalWeight += weight.value();
            }
        }

        double weighted = 0.0;
        for (Weight weight : Weight.values()) {
            Integer score = weight.scoreIn(components);
            if (score != null) {
                weighted += Math.max(0, Math.min(100, score)) * (weight.value() / totalWeight);
            }
        }

        int overall = ReferenceCurve.round(weighted);
        logger.debug("Recovery score {} from {}", overall, components);
        return overall;
    }
}
