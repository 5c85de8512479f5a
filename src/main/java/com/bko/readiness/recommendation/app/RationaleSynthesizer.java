package com.bko.readiness.recommendation.app;

import com.bko.readiness.recommendation.TrainingConstraints;
import com.bko.readiness.recommendation.TrainingPhase;
import com.bko.readiness.recovery.AnomalyResult;
import com.bko.readiness.recovery.AnomalySeverity;
import com.bko.readiness.recovery.ComponentScores;
import com.bko.readiness.recovery.RecoveryScore;
import com.bko.readiness.recovery.TrainingIntensity;
import com.bko.readiness.recovery.WorkoutSample;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Writes the plain-language reason for a recommendation: how recovered the athlete is, which
 * signals stand out, any health alert, the training context and what to do today.
 */
@Component
public class RationaleSynthesizer {
    static final int RECENT_DAYS = 3;

    public String synthesize(TrainingIntensity intensity,
                             String workoutType,
                             RecoveryScore score,
                             AnomalyResult anomalies,
                             List<WorkoutSample> recentWorkouts,
                             LocalDate today,
                             TrainingConstraints constraints) {
        Integer overall = score == null ? null : score.overallScore();
        String session = workoutType == null ? "easy" : workoutType.replace('_', ' ');
        List<String> parts = new ArrayList<>();
        parts.add(opening(overall));
        if (score != null) {
            addIfNotBlank(parts, components(score.components()));
        }
        addIfNotBlank(parts, anomalies(anomalies));
        addIfNotBlank(parts, trainingContext(recentWorkouts, today, constraints));
        parts.add(closing(intensity, session, overall));
        return String.join(" ", parts);
    }

    private String opening(Integer score) {
        if (score == null) {
            return "Not enough recovery data to score today, so the recommendation stays conservative.";
        }
        if (score >= 90) {
            return "Excellent recovery (Score: " + score + "/100)! You're well-recovered and ready for high-intensity training.";
        }
        if (score >= 70) {
            return "Good recovery (Score: " + score + "/100). Your body is ready for quality training.";
        }
        if (score >= 50) {
            return "Moderate recovery (Score: " + score + "/100). Your body needs a more conservative approach today.";
        }
        if (score >= 30) {
            return "Low recovery (Score: " + score + "/100). Your body is showing signs of fatigue and needs easier training.";
        }
        return "Very low recovery (Score: " + score + "/100). Your body urgently needs rest to avoid overtraining.";
    }

    private String components(ComponentScores components) {
        List<String> callouts = new ArrayList<>();
        if (components.hrvScore() != null && components.hrvScore() < 30) {
            callouts.add("Your HRV is significantly suppressed (Score: " + components.hrvScore()
                    + "/100), indicating your nervous system needs recovery.");
        }
        if (components.hrScore() != null && components.hrScore() < 30) {
            callouts.add("Your resting heart rate is elevated (Score: " + components.hrScore()
                    + "/100), which can indicate stress, fatigue, or illness.");
        }
        if (components.sleepScore() != null && components.sleepScore() < 40) {
            callouts.add("Poor sleep quality (Score: " + components.sleepScore()
                    + "/100) is limiting your recovery capacity.");
        }
        if (components.acwrScore() != null && components.acwrScore() < 30) {
            callouts.add("Your training load ratio (Score: " + components.acwrScore()
                    + "/100) indicates high injury risk from rapid training increases.");
        }
        return String.join(" ", callouts);
    }

    private String anomalies(AnomalyResult anomalies) {
        if (anomalies == null || anomalies.firstWarning() == null) {
            return "";
        }
        if (anomalies.severity() == AnomalySeverity.CRITICAL) {
            return "CRITICAL WARNING: " + anomalies.firstWarning()
                    + " Training is strongly discouraged until metrics improve.";
        }
        if (anomalies.severity() == AnomalySeverity.WARNING) {
            return "Warning: " + anomalies.firstWarning();
        }
        return "";
    }

    private String trainingContext(List<WorkoutSample> recentWorkouts, LocalDate today, TrainingConstraints constraints) {
        List<String> notes = new ArrayList<>();
        List<WorkoutSample> recent = recentDays(recentWorkouts, today);
        if (recent.stream().filter(WorkoutSample::isHard).count() >= 2) {
            notes.add("You've completed multiple hard sessions recently, so be cautious about adding another "
                    + "consecutive high-intensity day.");
        }
        Optional<Long> daysSinceRace = recent.stream()
                .filter(WorkoutSample::isRace)
                .map(workout -> DAYS.between(workout.date(), today))
                .min(Long::compare);
        daysSinceRace.ifPresent(days -> notes.add("You raced " + days + (days == 1 ? " day" : " days")
                + " ago, so prioritizing recovery is essential."));

        TrainingPhase phase = constraints == null ? null : constraints.phase();
        if (phase == TrainingPhase.BASE) {
            notes.add("During base building, focus on developing aerobic capacity through consistent, "
                    + "moderate-intensity training.");
        } else if (phase == TrainingPhase.BUILD) {
            notes.add("In the build phase, incorporate quality intensity work while managing fatigue.");
        } else if (phase == TrainingPhase.TAPER) {
            notes.add("Taper week: maintain intensity but reduce volume to arrive fresh for your event.");
        }

        Integer daysUntilRace = constraints == null ? null : constraints.daysUntilRace();
        if (daysUntilRace != null && daysUntilRace <= 7) {
            notes.add("With " + daysUntilRace + " days until your race, prioritize freshness over fitness gains.");
        }
        return String.join(" ", notes);
    }

    private String closing(TrainingIntensity intensity, String session, Integer score) {
        if (intensity == TrainingIntensity.HARD) {
            return "Today is a great day for a challenging " + session + " workout to build fitness and push your limits.";
        }
        if (intensity == TrainingIntensity.MODERATE) {
            if (score != null && score >= 60) {
                return "A " + session + " session at moderate intensity will build fitness while allowing continued recovery.";
            }
            return "Keep it moderate with " + session + " today, erring on the side of easier effort if you feel fatigued.";
        }
        if (score != null && score < 30) {
            return "Complete rest is your best training today. Recovery is when adaptation happens, "
                    + "and pushing through fatigue will only delay your progress.";
        }
        return "Easy " + session + " activity or complete rest will help you bounce back stronger. "
                + "Listen to your body and don't hesitate to take full rest if needed.";
    }

    /**
     * Workouts from today and the three days before it.
     */
    private List<WorkoutSample> recentDays(List<WorkoutSample> workouts, LocalDate today) {
        if (workouts == null || today == null) {
            return List.of();
        }
        LocalDate cutoff = today.minusDays(RECENT_DAYS);
        return workouts.stream()
                .filter(workout -> workout != null && !workout.date().isBefore(cutoff) && !workout.date().isAfter(today))
                .toList();
    }

    private static void addIfNotBlank(List<String> parts, String part) {
        if (part != null && !part.isBlank()) {
            parts.add(part);
        }
    }
}
