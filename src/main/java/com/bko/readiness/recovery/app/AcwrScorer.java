package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.WorkoutSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Scores the acute:chronic workload ratio, the last week's mean training stress over the last four
 * weeks' mean. Ratios between 0.8 and 1.3 score 100; spikes and detraining both lose points.
 */
@Component
public class AcwrScorer {
    private static final Logger logger = LoggerFactory.getLogger(AcwrScorer.class);
    static final int ACUTE_DAYS = 7;
    static final int CHRONIC_DAYS = 28;
    private static final ReferenceCurve RATIO_CURVE = ReferenceCurve.of(
            0.5, 30,
            0.8, 100,
            1.3, 100,
            1.5, 30,
            2.0, 0
    );

    /**
     * Scores the workload ratio as of {@code today}. Days between the last workout and today count
     * as zero load; a {@code null} date ends the series at the last workout.
     */
    public Integer score(List<WorkoutSample> workouts, LocalDate today) {
        if (workouts == null || workouts.isEmpty()) {
            logger.debug("No workouts for ACWR");
            return null;
        }
        return scoreDailyLoads(toDailyLoads(workouts, today));
    }

    /**
     * Scores a series of daily training stress totals, oldest first. A {@code null} day counts as
     * zero load.
     */
    public Integer scoreDailyLoads(List<Double> dailyLoads) {
        if (dailyLoads == null || dailyLoads.size() < CHRONIC_DAYS) {
            logger.debug("Not enough training history for ACWR: {} of {} days",
                    dailyLoads == null ? 0 : dailyLoads.size(), CHRONIC_DAYS);
            return null;
        }
        for (Double load : dailyLoads) {
            if (load != null && load < 0) {
                logger.warn("Ignoring ACWR for a series with negative training stress {}", load);
                return null;
            }
        }
        double acute = meanOfLast(dailyLoads, ACUTE_DAYS);
        double chronic = meanOfLast(dailyLoads, CHRONIC_DAYS);
        if (chronic == 0) {
            logger.debug("Chronic load is zero, ACWR undefined");
            return null;
        }
        double ratio = acute / chronic;
        int score = RATIO_CURVE.scoreAt(ratio);
        logger.debug("ACWR acute={} chronic={} ratio={} -> {}", String.format("%.1f", acute),
                String.format("%.1f", chronic), String.format("%.2f", ratio), score);
        return score;
    }

    /**
     * Sums training stress per calendar day, from the first workout date to {@code end} (or the last
     * workout date when {@code end} is {@code null}), filling days without workouts with zero.
     * Workouts after {@code end} are ignored.
     */
    static List<Double> toDailyLoads(List<WorkoutSample> workouts, LocalDate end) {
        TreeMap<LocalDate, Double> byDate = new TreeMap<>();
        for (WorkoutSample workout : workouts) {
            if (workout != null && (end == null || !workout.date().isAfter(end))) {
                byDate.merge(workout.date(), workout.loadOrZero(), Double::sum);
            }
        }
        if (byDate.isEmpty()) {
            return List.of();
        }
        LocalDate first = byDate.firstKey();
        LocalDate last = end == null ? byDate.lastKey() : end;
        List<Double> loads = new ArrayList<>();
        for (long day = 0; day <= DAYS.between(first, last); day++) {
            loads.add(byDate.getOrDefault(first.plusDays(day), 0.0));
        }
        return loads;
    }

    private double meanOfLast(List<Double> loads, int days) {
        double sum = 0.0;
        for (Double load : loads.subList(loads.size() - days, loads.size())) {
            sum += load == null ? 0.0 : load;
        }
        return sum / days;
    }
}
