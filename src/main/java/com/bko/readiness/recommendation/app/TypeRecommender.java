package com.bko.readiness.recommendation.app;

import com.bko.readiness.recommendation.TrainingConstraints;
import com.bko.readiness.recommendation.TrainingPhase;
import com.bko.readiness.recommendation.WorkoutStructure;
import com.bko.readiness.recovery.TrainingIntensity;
import com.bko.readiness.recovery.WorkoutSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks a concrete session for an intensity tier and lays out its structure. Selection avoids
 * repeating what the athlete did in the last five days, leans toward the current training phase
 * and toward long sessions at the weekend, then picks at random among what is left.
 */
@Component
public class TypeRecommender {
    private static final Logger logger = LoggerFactory.getLogger(TypeRecommender.class);

    static final String GENERAL_SPORT = "general";
    static final int VARIETY_WINDOW_DAYS = 5;
    static final int MAX_ALTERNATIVES = 2;
    static final int ALTERNATIVE_ATTEMPTS = 3;
    private static final int WARMUP_MINUTES = 10;
    private static final int COOLDOWN_MINUTES = 10;

    private static final Map<String, List<String>> HARD_TYPES = Map.of(
            "cycling", List.of("intervals", "threshold", "climbs", "sweet_spot", "vo2max", "criterium"),
            "running", List.of("intervals", "threshold", "tempo", "hill_repeats", "fartlek", "track_workout"),
            "swimming", List.of("intervals", "threshold_swim", "sprint_sets", "race_pace"),
            "triathlon", List.of("brick_workout", "intervals", "threshold", "race_simulation"),
            GENERAL_SPORT, List.of("intervals", "threshold", "tempo", "hills")
    );
    private static final Map<String, List<String>> MODERATE_TYPES = Map.of(
            "cycling", List.of("tempo", "steady_state", "long_ride", "endurance", "group_ride"),
            "running", List.of("tempo", "steady", "long_run", "progression", "aerobic"),
            "swimming", List.of("steady_swim", "technique", "endurance_swim", "pull_sets"),
            "triathlon", List.of("long_bike", "long_run", "open_water_swim", "aerobic"),
            GENERAL_SPORT, List.of("tempo", "steady", "aerobic", "endurance")
    );
    private static final Map<String, List<String>> REST_TYPES = Map.of(
            "cycling", List.of("recovery_ride", "easy_spin", "rest"),
            "running", List.of("recovery_run", "easy", "rest"),
            "swimming", List.of("swim_recovery", "technique", "rest"),
            "triathlon", List.of("easy_swim", "recovery_ride", "yoga", "rest"),
            GENERAL_SPORT, List.of("recovery", "easy", "active_recovery", "yoga", "rest")
    );
    private static final List<String> LOW_IMPACT_TYPES = List.of("swim", "bike", "pool_running", "yoga", "rest");
    private static final Map<TrainingPhase, List<String>> PHASE_PREFERENCES = Map.of(
            TrainingPhase.BASE, List.of("aerobic", "endurance", "steady", "long_ride", "long_run"),
            TrainingPhase.BUILD, List.of("intervals", "threshold", "tempo", "vo2max"),
            TrainingPhase.PEAK, List.of("race_pace", "race_simulation", "threshold"),
            TrainingPhase.TAPER, List.of("recovery", "easy", "short_intervals")
    );

    private final RandomSource randomSource;

    public TypeRecommender(RandomSource randomSource) {
        this.randomSource = randomSource;
    }

    public TypeSelection recommend(TrainingIntensity intensity,
                                   String sport,
                                   LocalDate date,
                                   List<WorkoutSample> recentWorkouts,
                                   TrainingConstraints constraints,
                                   Integer overallScore,
                                   Set<String> excludedTypes) {
        TrainingConstraints context = constraints == null ? TrainingConstraints.NONE : constraints;
        String primaryType = selectType(intensity, sport, date, recentWorkouts, context, excludedTypes);

        Set<String> used = new LinkedHashSet<>();
        used.add(primaryType);
        List<TypeOption> alternatives = new ArrayList<>();
        for (int attempt = 0; attempt < ALTERNATIVE_ATTEMPTS && alternatives.size() < MAX_ALTERNATIVES; attempt++) {
            Set<String> excluded = new HashSet<>(used);
            if (excludedTypes != null) {
                excluded.addAll(excludedTypes);
            }
            String alternative = selectType(intensity, sport, date, recentWorkouts, context, excluded);
            if (used.add(alternative)) {
                alternatives.add(new TypeOption(alternative, structureFor(alternative, intensity, overallScore, context)));
            }
        }

        logger.debug("Selected {} for {} {} with alternatives {}", primaryType, intensity, sport,
                alternatives.stream().map(TypeOption::workoutType).toList());
        return new TypeSelection(new TypeOption(primaryType, structureFor(primaryType, intensity, overallScore, context)),
                alternatives);
    }

    public String selectType(TrainingIntensity intensity,
                             String sport,
                             LocalDate date,
                             List<WorkoutSample> recentWorkouts,
                             TrainingConstraints constraints,
                             Set<String> excludedTypes) {
        TrainingIntensity tier = intensity == null ? TrainingIntensity.MODERATE : intensity;
        List<String> catalog = catalogFor(tier, sport);

        if (tier.isRestTier() && constraints != null && constraints.hasInjury()
                && constraints.injuryLocation().contains("lower_leg")) {
            return randomSource.pick(LOW_IMPACT_TYPES);
        }

        Set<String> avoid = recentTypes(date, recentWorkouts);
        if (excludedTypes != null) {
            avoid.addAll(excludedTypes);
        }
        List<String> candidates = catalog.stream().filter(type -> !avoid.contains(type)).toList();
        if (candidates.isEmpty()) {
            candidates = catalog;
        }

        TrainingPhase phase = constraints == null ? null : constraints.phase();
        if (phase != null) {
            List<String> preferred = PHASE_PREFERENCES.get(phase);
            List<String> matched = candidates.stream()
                    .filter(type -> preferred.stream().anyMatch(type::contains))
                    .toList();
            if (!matched.isEmpty()) {
                candidates = matched;
            }
        }

        if (isWeekend(date)) {
            List<String> longSessions = candidates.stream()
                    .filter(type -> type.contains("long") || type.contains("endurance"))
                    .toList();
            if (!longSessions.isEmpty()) {
                candidates = longSessions;
            }
        }

        return randomSource.pick(candidates);
    }

    public WorkoutStructure structureFor(String workoutType, TrainingIntensity intensity, Integer overallScore,
                                         TrainingConstraints constraints) {
        TrainingConstraints context = constraints == null ? TrainingConstraints.NONE : constraints;
        if (workoutType.contains("intervals") || workoutType.equals("vo2max")) {
            return intervalStructure(workoutType, intensity, overallScore, context);
        }
        if (workoutType.contains("tempo") || workoutType.contains("threshold")) {
            return tempoStructure(workoutType, overallScore, context);
        }
        if (workoutType.equals("rest")) {
            return WorkoutStructure.completeRest();
        }
        if (workoutType.contains("recovery") || workoutType.contains("easy")) {
            return WorkoutStructure.easy(45);
        }
        return steadyStructure(workoutType, overallScore, context);
    }

    List<String> catalogFor(TrainingIntensity intensity, String sport) {
        Map<String, List<String>> bySport = switch (intensity) {
            case HARD -> HARD_TYPES;
            case MODERATE -> MODERATE_TYPES;
            case REST, RECOVERY -> REST_TYPES;
        };
        List<String> catalog = sport == null ? null : bySport.get(sport);
        return catalog == null ? bySport.get(GENERAL_SPORT) : catalog;
    }

    private WorkoutStructure intervalStructure(String workoutType, TrainingIntensity intensity, Integer score,
                                               TrainingConstraints constraints) {
        int work;
        int rest;
        int intervals;
        if (workoutType.contains("vo2max") || intensity == TrainingIntensity.HARD) {
            work = 5;
            rest = 3;
            intervals = 8;
        } else {
            work = 3;
            rest = 2;
            intervals = 6;
        }

        if (score != null && score >= 90) {
            intervals += 2;
        } else if (score != null && score < 60) {
            intervals = Math.max(4, intervals - 2);
        }
        if (constraints.weekNumber() != null) {
            intervals += Math.min(constraints.weekNumber() - 1, 3);
        }
        if (constraints.recoveryWeek()) {
            intervals = Math.max(4, (int) (intervals * 0.6));
        }
        if (constraints.isTaper()) {
            intervals = Math.min(intervals, 6);
            work = Math.max(3, work - 1);
        }
        return WorkoutStructure.intervals(work, rest, intervals, WARMUP_MINUTES, COOLDOWN_MINUTES);
    }

    private WorkoutStructure tempoStructure(String workoutType, Integer score, TrainingConstraints constraints) {
        int duration = workoutType.contains("threshold") ? 45 : 30;
        if (score != null && score >= 85) {
            duration += 15;
        } else if (score != null && score < 60) {
            duration = Math.max(20, duration - 15);
        }
        if (constraints.recoveryWeek()) {
            duration = (int) (duration * 0.7);
        }
        return WorkoutStructure.tempo(duration, WARMUP_MINUTES, COOLDOWN_MINUTES);
    }

    private WorkoutStructure steadyStructure(String workoutType, Integer score, TrainingConstraints constraints) {
        int duration = workoutType.contains("long") ? 120 : 75;
        if (score != null && score >= 85) {
            duration += 30;
        } else if (score != null && score < 60) {
            duration = Math.max(60, duration - 30);
        }
        if (constraints.recoveryWeek()) {
            duration = (int) (duration * 0.75);
        }
        return WorkoutStructure.steady(duration);
    }

    private Set<String> recentTypes(LocalDate date, List<WorkoutSample> recentWorkouts) {
        Set<String> types = new HashSet<>();
        if (recentWorkouts == null || date == null) {
            return types;
        }
        LocalDate cutoff = date.minusDays(VARIETY_WINDOW_DAYS);
        for (WorkoutSample workout : recentWorkouts) {
            if (workout != null && !workout.date().isBefore(cutoff)) {
                types.add(workout.workoutType());
            }
        }
        return types;
    }

    private boolean isWeekend(LocalDate date) {
        return date != null && (date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY);
    }

    public record TypeOption(String workoutType, WorkoutStructure structure) {
    }

    public record TypeSelection(TypeOption primary, List<TypeOption> alternatives) {
        public TypeSelection {
            alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        }
    }
}
