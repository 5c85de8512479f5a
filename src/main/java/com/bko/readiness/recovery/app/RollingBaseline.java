package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.HealthSample;

import java.util.List;
import java.util.function.Function;

final class RollingBaseline {
    static final int WINDOW_DAYS = 7;
    static final int MIN_VALID_DAYS = 4;

    private RollingBaseline() {
    }

    /**
     * Mean of the positive readings among the most recent seven entries, or {@code null} when fewer
     * than four of them carry a reading.
     */
    static Double average(List<HealthSample> history, Function<HealthSample, Double> reading) {
        if (history == null || history.isEmpty()) {
            return null;
        }
        List<HealthSample> window = history.subList(Math.max(0, history.size() - WINDOW_DAYS), history.size());
        double sum = 0.0;
        int valid = 0;
        for (HealthSample sample : window) {
            Double value = sample == null ? null : reading.apply(sample);
            if (value != null && value > 0) {
                sum += value;
                valid++;
            }
        }
        if (valid < MIN_VALID_DAYS) {
            return null;
        }
        return sum / valid;
    }

    static double deviationPercent(double today, double baseline) {
        return (today - baseline) / baseline * 100.0;
    }
}
