package com.bko.readiness;

import com.bko.readiness.engine.ReadinessReport;
import com.bko.readiness.engine.ReadinessRequest;
import com.bko.readiness.engine.ReadinessUseCase;
import com.bko.readiness.recovery.HealthSample;
import com.bko.readiness.recovery.RecoveryStatus;
import com.bko.readiness.recovery.TrainingIntensity;
import com.bko.readiness.recovery.WorkoutSample;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class ReadinessEngineApplicationTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 28);

    @Autowired
    private ReadinessUseCase readinessUseCase;

    @Test
    void evaluatesWellRecoveredDay() {
        List<HealthSample> history = new ArrayList<>();
        for (int day = 7; day >= 1; day--) {
            history.add(HealthSample.of(TODAY.minusDays(day), 60.0, 50));
        }
        List<WorkoutSample> workouts = new ArrayList<>();
        for (int day = 27; day >= 0; day--) {
            workouts.add(new WorkoutSample(TODAY.minusDays(day), "endurance", TrainingIntensity.MODERATE, 100.0));
        }

        ReadinessReport report = readinessUseCase.evaluate(ReadinessRequest.of(
                new HealthSample(TODAY, 66.0, 47, 8 * 3600L, 90), history, workouts));

        assertEquals(99, report.assessment().score().overallScore());
        assertEquals(RecoveryStatus.GREEN, report.assessment().score().status());
        assertEquals(TrainingIntensity.HARD, report.recommendation().intensity());
        assertTrue(report.recommendation().durationMinutes() > 0);
        assertTrue(report.alternatives().size() <= 4);
    }
}
