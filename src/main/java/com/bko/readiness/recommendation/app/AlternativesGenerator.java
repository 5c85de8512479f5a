package com.bko.readiness.recommendation.app;

import com.bko.readiness.recommendation.AlternativeWorkout;
import com.bko.readiness.recommendation.TrainingConstraints;
import com.bko.readiness.recommendation.WorkoutRecommendation;
import com.bko.readiness.recommendation.WorkoutStructure;
import com.bko.readiness.recovery.TrainingIntensity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Offers other ways to train today when the primary session does not fit: another session at the
 * same intensity, a more conservative one, cross-training around an injury, a short session for a
 * tight schedule and an indoor session for bad weather.
 */
@Component
public class AlternativesGenerator {
    private static final Logger logger = LoggerFactory.getLogger(AlternativesGenerator.class);

    static final int MAX_ALTERNATIVES = 4;
    static final int SHORT_SESSION_MINUTES = 60;
    static final int CROSS_TRAINING_MAX_MINUTES = 45;

    private static final Map<String, List<String>> CROSS_TRAINING = Map.of(
            "lower_leg", List.of("swimming", "pool_running", "bike"),
            "knee", List.of("swimming", "upper_body"),
            "hip", List.of("swimming", "upper_body"),
            "upper_body", List.of("running", "bike", "lower_body"),
            "foot", List.of("swimming", "bike")
    );
    private static final List<String> DEFAULT_CROSS_TRAINING = List.of("swimming", "yoga");
    private static final Map<String, String> INDOOR_EQUIVALENTS = Map.of(
            "cycling", "trainer",
            "running", "treadmill",
            "triathlon", "trainer_or_treadmill",
            "swimming", "pool"
    );

    private final TypeRecommender typeRecommender;

    public AlternativesGenerator(TypeRecommender typeRecommender) {
        this.typeRecommender = typeRecommender;
    }

    public List<AlternativeWorkout> generate(WorkoutRecommendation primary,
                                             String sport,
                                             Integer overallScore,
                                             LocalDate date,
                                             TrainingConstraints constraints) {
        TrainingConstraints context = constraints == null ? TrainingConstraints.NONE : constraints;
        List<AlternativeWorkout> candidates = new ArrayList<>();

        addIfPresent(candidates, sameIntensity(primary, sport, overallScore, date, context));
        addIfPresent(candidates, lowerIntensity(primary, sport, overallScore, date, context));
        if (context.hasInjury()) {
            candidates.add(crossTraining(primary, context.injuryLocation()));
        }
        if (context.timeAvailableMinutes() != null) {
            addIfPresent(candidates, timeConstrained(primary, overallScore, context));
        }
        if (context.badWeather()) {
            candidates.add(indoor(primary, sport, overallScore, date, context));
        }

        List<AlternativeWorkout> alternatives = new ArrayList<>();
        Set<String> seenTypes = new HashSet<>();
        for (AlternativeWorkout candidate : candidates) {
            if (seenTypes.add(candidate.workoutType())) {
                alternatives.add(candidate);
            }
        }
        if (alternatives.size() > MAX_ALTERNATIVES) {
            alternatives = new ArrayList<>(alternatives.subList(0, MAX_ALTERNATIVES));
        }
        logger.debug("Generated {} alternative(s) to {}", alternatives.size(), primary.workoutType());
        return alternatives;
    }

    private AlternativeWorkout sameIntensity(WorkoutRecommendation primary, String sport, Integer score,
                                             LocalDate date, TrainingConstraints constraints) {
        TypeRecommender.TypeSelection selection = typeRecommender.recommend(primary.intensity(), sport, date, List.of(),
                constraints, score, Set.of(primary.workoutType()));
        for (TypeRecommender.TypeOption option : selection.alternatives()) {
            if (!option.workoutType().equals(primary.workoutType())) {
                return new AlternativeWorkout(primary.intensity(), option.workoutType(),
                        option.structure().totalDurationMinutes(), option.structure(),
                        "Alternative " + option.workoutType() + " workout providing a similar training stimulus at "
                                + primary.intensity() + " intensity.");
            }
        }
        return null;
    }

    private AlternativeWorkout lowerIntensity(WorkoutRecommendation primary, String sport, Integer score,
                                              LocalDate date, TrainingConstraints constraints) {
        TrainingIntensity lower = switch (primary.intensity()) {
            case HARD -> TrainingIntensity.MODERATE;
            case MODERATE -> TrainingIntensity.REST;
            case REST, RECOVERY -> null;
        };
        if (lower == null) {
            return null;
        }
        String type = typeRecommender.selectType(lower, sport, date, List.of(), constraints, Set.of());
        WorkoutStructure structure = typeRecommender.structureFor(type, lower, score, constraints);
        return new AlternativeWorkout(lower, type, structure.totalDurationMinutes(), structure,
                "More conservative " + lower + " intensity option. Choose this if you're feeling more fatigued "
                        + "than expected or want to err on the side of caution.");
    }

    private AlternativeWorkout crossTraining(WorkoutRecommendation primary, String injuryLocation) {
        List<String> activities = CROSS_TRAINING.getOrDefault(injuryLocation, DEFAULT_CROSS_TRAINING);
        int minutes = Math.min(primary.durationMinutes(), CROSS_TRAINING_MAX_MINUTES);
        TrainingIntensity intensity = primary.intensity() == TrainingIntensity.HARD ? TrainingIntensity.REST : primary.intensity();
        return new AlternativeWorkout(intensity, "cross_training", minutes, WorkoutStructure.crossTraining(minutes, activities),
                "Low-impact cross-training to work around your " + injuryLocation + " injury. Options: "
                        + String.join(", ", activities) + ". Keep intensity low to promote healing.");
    }

    private AlternativeWorkout timeConstrained(WorkoutRecommendation primary, Integer score, TrainingConstraints constraints) {
        int budget = constraints.timeAvailableMinutes();
        if (budget >= SHORT_SESSION_MINUTES) {
            return null;
        }
        boolean hard = primary.intensity() == TrainingIntensity.HARD;
        String type = hard ? primary.workoutType() : "intervals";
        TrainingIntensity intensity = hard ? TrainingIntensity.HARD : TrainingIntensity.MODERATE;
        WorkoutStructure structure = typeRecommender.structureFor(type, intensity, score, constraints).fittedTo(budget);
        return new AlternativeWorkout(intensity, type, budget, structure,
                "Time-efficient " + budget + "-minute option maintaining training quality. "
                        + "Shorter duration compensated by focused execution.");
    }

    private AlternativeWorkout indoor(WorkoutRecommendation primary, String sport, Integer score,
                                      LocalDate date, TrainingConstraints constraints) {
        String equipment = INDOOR_EQUIVALENTS.getOrDefault(sport, "trainer");
        String type = typeRecommender.selectType(primary.intensity(), sport, date, List.of(), constraints, Set.of());
        int target = (int) Math.floor(primary.durationMinutes() * 0.9);
        WorkoutStructure structure = typeRecommender.structureFor(type, primary.intensity(), score, constraints)
                .fittedTo(target);
        return new AlternativeWorkout(primary.intensity(), "indoor_" + type, structure.totalDurationMinutes(), structure,
                "Indoor " + equipment + " option for adverse weather conditions. "
                        + "Maintain workout quality in a controlled environment.");
    }

    private static void addIfPresent(List<AlternativeWorkout> alternatives, AlternativeWorkout alternative) {
        if (alternative != null) {
            alternatives.add(alternative);
        }
    }
}
