package com.bko.readiness.recommendation.app;

import com.bko.readiness.recommendation.OvertrainingRisk;
import com.bko.readiness.recovery.RecoveryScore;
import com.bko.readiness.recovery.TrainingIntensity;
import com.bko.readiness.recovery.WorkoutSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Second opinion on a hard day. Downgrades it when the training pattern says the athlete has been
 * pushing too long, too often, is trending down, or just raced. The first check that fires wins.
 */
@Component
public class OvertrainingPrevention {
    private static final Logger logger = LoggerFactory.getLogger(OvertrainingPrevention.class);

    static final int MAX_CONSECUTIVE_HARD_DAYS = 3;
    static final int MAX_HARD_DAYS_IN_WINDOW = 5;
    static final int HARD_DAYS_WINDOW = 7;
    static final int TREND_MIN_SCORES = 7;
    static final double RECOVERY_DECLINE_THRESHOLD = -15.0;
    static final int POST_RACE_DAYS = 5;

    private final List<Check> checks = List.of(
            new Check("consecutive-hard-days", TrainingIntensity.MODERATE, this::consecutiveHardWarning),
            new Check("hard-day-frequency", TrainingIntensity.MODERATE, this::frequencyWarning),
            new Check("recovery-trend", TrainingIntensity.MODERATE, this::trendWarning),
            new Check("post-race", TrainingIntensity.REST, this::postRaceWarning)
    );

    public Decision check(TrainingIntensity proposed,
                          LocalDate today,
                          List<WorkoutSample> recentWorkouts,
                          List<RecoveryScore> recoveryHistory) {
        if (proposed != TrainingIntensity.HARD) {
            return Decision.unchanged(proposed);
        }
        TrainingHistory history = new TrainingHistory(today, nonNull(recentWorkouts), nonNull(recoveryHistory));
        for (Check check : checks) {
            Optional<String> warning = check.warning().apply(history);
            if (warning.isPresent()) {
                logger.info("Overtraining check {} downgraded hard to {} on {}", check.name(), check.downgradeTo(), today);
                return new Decision(check.downgradeTo(), warning.get());
            }
        }
        return Decision.unchanged(proposed);
    }

    public OvertrainingRisk assessRisk(LocalDate today, List<WorkoutSample> recentWorkouts, List<RecoveryScore> recoveryHistory) {
        TrainingHistory history = new TrainingHistory(today, nonNull(recentWorkouts), nonNull(recoveryHistory));
        int riskFactors = 0;
        if (consecutiveHardWarning(history).isPresent()) {
            riskFactors += 2;
        }
        if (frequencyWarning(history).isPresent()) {
            riskFactors += 2;
        }
        if (trendWarning(history).isPresent()) {
            riskFactors += 3;
        }
        OvertrainingRisk.Level level;
        if (riskFactors == 0) {
            level = OvertrainingRisk.Level.NONE;
        } else if (riskFactors <= 2) {
            level = OvertrainingRisk.Level.LOW;
        } else if (riskFactors <= 4) {
            level = OvertrainingRisk.Level.MEDIUM;
        } else {
            level = OvertrainingRisk.Level.HIGH;
        }
        return OvertrainingRisk.of(level);
    }

    /**
     * Counts the run of hard days ending at the latest workout, which must be today or yesterday.
     * A day without a workout or with only easier ones ends the run.
     */
    static int consecutiveHardDays(LocalDate today, List<WorkoutSample> workouts) {
        TreeSet<LocalDate> workoutDays = workouts.stream()
                .map(WorkoutSample::date)
                .filter(date -> !date.isAfter(today))
                .collect(Collectors.toCollection(TreeSet::new));
        if (workoutDays.isEmpty() || DAYS.between(workoutDays.last(), today) > 1) {
            return 0;
        }
        Set<LocalDate> hardDays = hardDays(workouts);
        int streak = 0;
        LocalDate day = workoutDays.last();
        while (hardDays.contains(day)) {
            streak++;
            day = day.minusDays(1);
        }
        return streak;
    }

    static int hardDaysInWindow(LocalDate today, List<WorkoutSample> workouts) {
        LocalDate cutoff = today.minusDays(HARD_DAYS_WINDOW);
        return (int) hardDays(workouts).stream()
                .filter(date -> !date.isBefore(cutoff) && !date.isAfter(today))
                .count();
    }

    private Optional<String> consecutiveHardWarning(TrainingHistory history) {
        int streak = consecutiveHardDays(history.today(), history.workouts());
        if (streak < MAX_CONSECUTIVE_HARD_DAYS) {
            return Optional.empty();
        }
        return Optional.of("Overtraining Prevention: You've completed " + streak + " consecutive hard training days. "
                + "Forcing an easier day to prevent overtraining and injury.");
    }

    private Optional<String> frequencyWarning(TrainingHistory history) {
        int hardDays = hardDaysInWindow(history.today(), history.workouts());
        if (hardDays < MAX_HARD_DAYS_IN_WINDOW) {
            return Optional.empty();
        }
        return Optional.of("Overtraining Prevention: You've completed " + hardDays + " hard days in the last "
                + HARD_DAYS_WINDOW + " days. Reducing intensity to allow adequate recovery.");
    }

    private Optional<String> trendWarning(TrainingHistory history) {
        List<RecoveryScore> scores = history.recoveryHistory();
        if (scores.size() < TREND_MIN_SCORES) {
            return Optional.empty();
        }
        double recent = mean(scores.subList(scores.size() - 3, scores.size()));
        double older = mean(scores.subList(scores.size() - 7, scores.size() - 3));
        double decline = recent - older;
        if (decline > RECOVERY_DECLINE_THRESHOLD) {
            return Optional.empty();
        }
        return Optional.of("Overtraining Prevention: Your recovery score has declined " + Math.abs((int) decline)
                + " points over recent days. This suggests cumulative fatigue. Reducing intensity to prevent overtraining.");
    }

    private Optional<String> postRaceWarning(TrainingHistory history) {
        return history.workouts().stream()
                .filter(WorkoutSample::isRace)
                .map(workout -> DAYS.between(workout.date(), history.today()))
                .filter(daysAgo -> daysAgo >= 0 && daysAgo <= POST_RACE_DAYS)
                .min(Long::compare)
                .map(daysAgo -> "Post-Race Recovery: You raced " + daysAgo + (daysAgo == 1 ? " day" : " days")
                        + " ago. Your body needs recovery time after race efforts. Forcing a rest day.");
    }

    private static Set<LocalDate> hardDays(List<WorkoutSample> workouts) {
        return workouts.stream()
                .filter(WorkoutSample::isHard)
                .map(WorkoutSample::date)
                .collect(Collectors.toSet());
    }

    private static double mean(List<RecoveryScore> scores) {
        return scores.stream().mapToInt(RecoveryScore::overallScore).average().orElse(0.0);
    }

    private static <T> List<T> nonNull(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    public record Decision(TrainingIntensity intensity, String warning) {
        static Decision unchanged(TrainingIntensity intensity) {
            return new Decision(intensity, null);
        }

        public boolean isDowngraded() {
            return warning != null;
        }
    }

    private record TrainingHistory(LocalDate today, List<WorkoutSample> workouts, List<RecoveryScore> recoveryHistory) {
    }

    private record Check(String name, TrainingIntensity downgradeTo, Function<TrainingHistory, Optional<String>> warning) {
    }
}
