package com.bko.readiness.recommendation;

import com.bko.readiness.recovery.InvalidMetricException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;

/**
 * Optional context that shapes the recommendation: the athlete's sport, where they are in the
 * training plan, the next race, and what limits today's session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrainingConstraints(
        String sport,
        TrainingPhase phase,
        Integer weekNumber,
        boolean recoveryWeek,
        Integer daysUntilRace,
        Integer timeAvailableMinutes,
        String injuryLocation,
        boolean badWeather
) {
    public static final TrainingConstraints NONE = new TrainingConstraints(null, null, null, false, null, null, null, false);

    public TrainingConstraints {
        sport = normalize(sport);
        injuryLocation = normalize(injuryLocation);
        if (weekNumber != null && weekNumber < 1) {
            throw new InvalidMetricException("Week number must be 1 or more, got " + weekNumber);
        }
        if (daysUntilRace != null && daysUntilRace < 0) {
            throw new InvalidMetricException("Days until race must not be negative, got " + daysUntilRace);
        }
        if (timeAvailableMinutes != null && timeAvailableMinutes <= 0) {
            throw new InvalidMetricException("Available time must be positive, got " + timeAvailableMinutes + " minutes");
        }
    }

    public static TrainingConstraints forSport(String sport) {
        return new TrainingConstraints(sport, null, null, false, null, null, null, false);
    }

    public boolean hasInjury() {
        return injuryLocation != null;
    }

    public boolean isTaper() {
        return phase == TrainingPhase.TAPER;
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.US);
    }
}
