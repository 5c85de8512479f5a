package com.bko.readiness.engine;

import com.bko.readiness.recommendation.TrainingConstraints;
import com.bko.readiness.recovery.HealthSample;
import com.bko.readiness.recovery.InvalidMetricException;
import com.bko.readiness.recovery.WorkoutSample;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadinessRequestTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 28);

    @Test
    void defaultsMissingParts() {
        ReadinessRequest request = new ReadinessRequest(HealthSample.of(TODAY, 60.0, 50), null, null, null, null);

        assertTrue(request.healthHistory().isEmpty());
        assertTrue(request.workoutHistory().isEmpty());
        assertTrue(request.recoveryHistory().isEmpty());
        assertEquals(TrainingConstraints.NONE, request.constraints());
    }

    @Test
    void rejectsMissingTodayAndEmptyEntries() {
        List<WorkoutSample> workouts = new ArrayList<>();
        workouts.add(null);
        List<HealthSample> health = new ArrayList<>();
        health.add(HealthSample.of(TODAY.minusDays(1), 60.0, 50));
        health.add(null);

        assertThrows(InvalidMetricException.class, () -> ReadinessRequest.of(null, List.of(), List.of()));
        assertThrows(InvalidMetricException.class,
                () -> ReadinessRequest.of(HealthSample.of(TODAY, 60.0, 50), List.of(), workouts));
        assertThrows(InvalidMetricException.class,
                () -> ReadinessRequest.of(HealthSample.of(TODAY, 60.0, 50), health, List.of()));
    }
}
