package com.bko.readiness.recommendation.app;

import com.bko.readiness.recommendation.AlternativeWorkout;
import com.bko.readiness.recommendation.TrainingConstraints;
import com.bko.readiness.recommendation.WorkoutRecommendation;
import com.bko.readiness.recommendation.WorkoutStructure;
import com.bko.readiness.recovery.TrainingIntensity;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlternativesGeneratorTest {
    private static final LocalDate MONDAY = LocalDate.of(2024, 3, 25);

    private final AlternativesGenerator generator = new AlternativesGenerator(new TypeRecommender(bound -> 0));

    @Test
    void offersSameAndLowerIntensityWithoutConstraints() {
        List<AlternativeWorkout> alternatives = generator.generate(hardIntervals(), "cycling", 80, MONDAY,
                TrainingConstraints.NONE);

        assertEquals(List.of("climbs", "tempo"), types(alternatives));
        assertEquals(TrainingIntensity.HARD, alternatives.get(0).intensity());
        assertEquals(75, alternatives.get(0).durationMinutes());
        assertEquals(TrainingIntensity.MODERATE, alternatives.get(1).intensity());
        assertEquals(50, alternatives.get(1).durationMinutes());
    }

    @Test
    void capsAtFourWhenEveryConstraintApplies() {
        TrainingConstraints constraints = new TrainingConstraints("cycling", null, null, false, null, 40, "knee", true);

        List<AlternativeWorkout> alternatives = generator.generate(hardIntervals(), "cycling", 80, MONDAY, constraints);

        assertEquals(List.of("climbs", "tempo", "cross_training", "intervals"), types(alternatives));

        AlternativeWorkout crossTraining = alternatives.get(2);
        assertEquals(TrainingIntensity.REST, crossTraining.intensity());
        assertEquals(45, crossTraining.durationMinutes());
        assertEquals(List.of("swimming", "upper_body"), crossTraining.structure().activities());
        assertTrue(crossTraining.rationale().contains("knee injury"));

        AlternativeWorkout shortSession = alternatives.get(3);
        assertEquals(TrainingIntensity.HARD, shortSession.intensity());
        assertEquals(40, shortSession.durationMinutes());
        assertEquals(40, shortSession.structure().totalDurationMinutes());
        assertEquals(3, shortSession.structure().intervals());
    }

    @Test
    void badWeatherAddsIndoorVersion() {
        TrainingConstraints constraints = new TrainingConstraints("cycling", null, null, false, null, null, null, true);

        List<AlternativeWorkout> alternatives = generator.generate(hardIntervals(), "cycling", 80, MONDAY, constraints);

        assertEquals(3, alternatives.size());
        AlternativeWorkout indoor = alternatives.get(2);
        assertEquals("indoor_intervals", indoor.workoutType());
        assertEquals(75, indoor.durationMinutes());
        assertEquals(75, indoor.structure().totalDurationMinutes());
        assertEquals(7, indoor.structure().intervals());
        assertTrue(indoor.rationale().contains("trainer"));
    }

    @Test
    void indoorVersionNeverRunsLongerThanItsStructure() {
        TrainingConstraints constraints = new TrainingConstraints("running", null, null, false, null, null, null, true);
        WorkoutStructure structure = WorkoutStructure.steady(40);
        WorkoutRecommendation primary = new WorkoutRecommendation(TrainingIntensity.MODERATE, "steady", 40, structure,
                "Steady.", List.of());

        List<AlternativeWorkout> alternatives = generator.generate(primary, "running", 80, MONDAY, constraints);

        AlternativeWorkout indoor = alternatives.get(alternatives.size() - 1);
        assertEquals("indoor_tempo", indoor.workoutType());
        assertEquals(indoor.structure().totalDurationMinutes(), indoor.durationMinutes());
        assertEquals(36, indoor.durationMinutes());
        assertTrue(indoor.rationale().contains("treadmill"));
    }

    @Test
    void ampleTimeAddsNoShortSession() {
        TrainingConstraints constraints = new TrainingConstraints("cycling", null, null, false, null, 60, null, false);

        List<AlternativeWorkout> alternatives = generator.generate(hardIntervals(), "cycling", 80, MONDAY, constraints);

        assertEquals(List.of("climbs", "tempo"), types(alternatives));
    }

    @Test
    void restDayOnlyOffersAnotherEasyOption() {
        WorkoutRecommendation rest = new WorkoutRecommendation(TrainingIntensity.REST, "rest", 0,
                WorkoutStructure.completeRest(), "Rest.", List.of());

        List<AlternativeWorkout> alternatives = generator.generate(rest, "cycling", 25, MONDAY, null);

        assertEquals(1, alternatives.size());
        assertEquals("easy_spin", alternatives.get(0).workoutType());
        assertEquals(45, alternatives.get(0).durationMinutes());
        assertEquals(TrainingIntensity.REST, alternatives.get(0).intensity());
    }

    private static WorkoutRecommendation hardIntervals() {
        WorkoutStructure structure = WorkoutStructure.intervals(5, 3, 8, 10, 10);
        return new WorkoutRecommendation(TrainingIntensity.HARD, "intervals", structure.totalDurationMinutes(), structure,
                "Go hard.", List.of());
    }

    private static List<String> types(List<AlternativeWorkout> alternatives) {
        return alternatives.stream().map(AlternativeWorkout::workoutType).toList();
    }
}
