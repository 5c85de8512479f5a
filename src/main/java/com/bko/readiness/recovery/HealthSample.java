package com.bko.readiness.recovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * One day of physiological readings as synced from the wearable. Every reading is optional;
 * an absent value means "not measured", which is different from a measured zero.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthSample(
        LocalDate date,
        Double hrvMs,
        Integer restingHr,
        Long sleepDurationSeconds,
        Integer sleepQualityScore
) {
    public HealthSample {
        if (date == null) {
            throw new InvalidMetricException("Health sample is missing its date");
        }
        if (hrvMs != null && (hrvMs.isNaN() || hrvMs.isInfinite() || hrvMs < 0)) {
            throw new InvalidMetricException("HRV must be a non-negative number, got " + hrvMs + " on " + date);
        }
        if (restingHr != null && restingHr < 0) {
            throw new InvalidMetricException("Resting HR must not be negative, got " + restingHr + " on " + date);
        }
        if (sleepDurationSeconds != null && sleepDurationSeconds < 0) {
            throw new InvalidMetricException("Sleep duration must not be negative, got "
                    + sleepDurationSeconds + "s on " + date);
        }
    }

    public static HealthSample of(LocalDate date, Double hrvMs, Integer restingHr) {
        return new HealthSample(date, hrvMs, restingHr, null, null);
    }

    public boolean hasHrv() {
        return hrvMs != null && hrvMs > 0;
    }

    public boolean hasRestingHr() {
        return restingHr != null && restingHr > 0;
    }

    public Double restingHrValue() {
        return restingHr == null ? null : restingHr.doubleValue();
    }
}
