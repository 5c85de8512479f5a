package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.TrainingIntensity;
import com.bko.readiness.recovery.WorkoutSample;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class AcwrScorerTest {
    private final AcwrScorer scorer = new AcwrScorer();

    @Test
    void steadyLoadScoresFull() {
        assertEquals(100, scorer.scoreDailyLoads(Collections.nCopies(28, 100.0)));
    }

    @Test
    void spikeInAcuteLoadScoresZero() {
        List<Double> loads = new ArrayList<>(Collections.nCopies(21, 50.0));
        loads.addAll(Collections.nCopies(7, 150.0));

        assertEquals(0, scorer.scoreDailyLoads(loads));
    }

    @Test
    void detrainingWeekScoresLow() {
        List<Double> loads = new ArrayList<>(Collections.nCopies(21, 100.0));
        loads.addAll(Collections.nCopies(7, 0.0));

        assertEquals(30, scorer.scoreDailyLoads(loads));
    }

    @Test
    void returnsNullForShortOrInvalidSeries() {
        assertNull(scorer.scoreDailyLoads(Collections.nCopies(27, 100.0)));
        assertNull(scorer.scoreDailyLoads(Collections.nCopies(28, 0.0)));

        List<Double> negative = new ArrayList<>(Collections.nCopies(28, 100.0));
        negative.set(3, -10.0);
        assertNull(scorer.scoreDailyLoads(negative));
    }

    @Test
    void sumsWorkoutsPerDayAndFillsGaps() {
        LocalDate start = LocalDate.of(2024, 3, 1);
        List<WorkoutSample> workouts = List.of(
                new WorkoutSample(start, "tempo", TrainingIntensity.MODERATE, 50.0),
                new WorkoutSample(start, "strength", TrainingIntensity.MODERATE, 30.0),
                new WorkoutSample(start.plusDays(2), "easy", TrainingIntensity.RECOVERY, 20.0)
        );

        assertEquals(List.of(80.0, 0.0, 20.0), AcwrScorer.toDailyLoads(workouts, null));
        assertEquals(List.of(80.0, 0.0, 20.0, 0.0, 0.0), AcwrScorer.toDailyLoads(workouts, start.plusDays(4)));
        assertEquals(List.of(80.0), AcwrScorer.toDailyLoads(workouts, start));
    }

    @Test
    void scoresWorkoutHistory() {
        LocalDate start = LocalDate.of(2024, 3, 1);
        List<WorkoutSample> workouts = new ArrayList<>();
        for (int day = 0; day < 28; day++) {
            workouts.add(new WorkoutSample(start.plusDays(day), "endurance", TrainingIntensity.MODERATE, 100.0));
        }

        assertEquals(100, scorer.score(workouts, start.plusDays(27)));
        assertNull(scorer.score(workouts.subList(0, 20), start.plusDays(19)));
        assertNull(scorer.score(List.of(), start));
    }

    @Test
    void idleDaysBeforeTodayCountAsZeroLoad() {
        LocalDate start = LocalDate.of(2024, 3, 1);
        List<WorkoutSample> workouts = new ArrayList<>();
        for (int day = 0; day < 28; day++) {
            workouts.add(new WorkoutSample(start.plusDays(day), "endurance", TrainingIntensity.MODERATE, 100.0));
        }
        LocalDate tenDaysIdle = start.plusDays(37);

        assertEquals(30, scorer.score(workouts, tenDaysIdle));
        assertEquals(100, scorer.score(workouts, null));
    }
}
