package com.bko.readiness.recovery;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthSampleTest {
    private static final LocalDate DAY = LocalDate.of(2024, 3, 28);

    @Test
    void rejectsInvalidReadings() {
        assertThrows(InvalidMetricException.class, () -> HealthSample.of(null, 60.0, 50));
        assertThrows(InvalidMetricException.class, () -> HealthSample.of(DAY, -1.0, 50));
        assertThrows(InvalidMetricException.class, () -> HealthSample.of(DAY, Double.NaN, 50));
        assertThrows(InvalidMetricException.class, () -> HealthSample.of(DAY, Double.POSITIVE_INFINITY, 50));
        assertThrows(InvalidMetricException.class, () -> HealthSample.of(DAY, 60.0, -5));
        assertThrows(InvalidMetricException.class, () -> new HealthSample(DAY, 60.0, 50, -60L, null));
    }

    @Test
    void missingReadingsAreAllowed() {
        HealthSample sample = new HealthSample(DAY, null, null, null, null);

        assertFalse(sample.hasHrv());
        assertFalse(sample.hasRestingHr());
        assertNull(sample.restingHrValue());
    }

    @Test
    void zeroIsMeasuredButNotUsable() {
        HealthSample sample = HealthSample.of(DAY, 0.0, 0);

        assertFalse(sample.hasHrv());
        assertFalse(sample.hasRestingHr());
        assertEquals(0.0, sample.restingHrValue());
    }

    @Test
    void qualityScoreIsNotRejected() {
        HealthSample sample = new HealthSample(DAY, 55.0, 48, 27000L, 140);

        assertTrue(sample.hasHrv());
        assertEquals(140, sample.sleepQualityScore());
    }
}
