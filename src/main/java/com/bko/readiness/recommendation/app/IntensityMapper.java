package com.bko.readiness.recommendation.app;

import com.bko.readiness.recommendation.IntensityGuidance;
import com.bko.readiness.recovery.AnomalyResult;
import com.bko.readiness.recovery.AnomalySeverity;
import com.bko.readiness.recovery.RecoveryScore;
import com.bko.readiness.recovery.RecoveryStatus;
import com.bko.readiness.recovery.TrainingIntensity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a recovery score to a training intensity tier. A critical anomaly always means rest and a
 * warning drops the tier by one step; with no score at all the athlete rests.
 */
@Component
public class IntensityMapper {
    private static final Logger logger = LoggerFactory.getLogger(IntensityMapper.class);

    public TrainingIntensity map(RecoveryScore score, AnomalyResult anomalies) {
        AnomalySeverity severity = anomalies == null ? AnomalySeverity.NONE : anomalies.severity();
        return map(score == null ? null : score.overallScore(), severity);
    }

    public TrainingIntensity map(Integer overallScore, AnomalySeverity severity) {
        if (overallScore == null) {
            logger.debug("No recovery score, defaulting to rest");
            return TrainingIntensity.REST;
        }
        return adjustForAnomalies(tierFor(overallScore), severity);
    }

    /**
     * Maps a score that comes with a persisted status label. A label this engine does not know is
     * treated with suspicion: it never yields hard, and without a score it means rest.
     */
    public TrainingIntensity map(String statusLabel, Integer overallScore, AnomalySeverity severity) {
        RecoveryStatus status = RecoveryStatus.fromLabel(statusLabel);
        if (overallScore != null) {
            TrainingIntensity intensity = map(overallScore, severity);
            if (status == null && intensity == TrainingIntensity.HARD) {
                logger.debug("Unrecognized recovery status '{}', capping intensity at moderate", statusLabel);
                return TrainingIntensity.MODERATE;
            }
            return intensity;
        }
        if (status == null) {
            logger.debug("Unrecognized recovery status '{}' without a score, defaulting to rest", statusLabel);
            return TrainingIntensity.REST;
        }
        TrainingIntensity base = switch (status) {
            case GREEN -> TrainingIntensity.HARD;
            case YELLOW -> TrainingIntensity.MODERATE;
            case RED -> TrainingIntensity.REST;
        };
        return adjustForAnomalies(base, severity);
    }

    public IntensityGuidance guidanceFor(TrainingIntensity intensity, Integer overallScore, AnomalySeverity severity) {
        String score = overallScore == null ? "n/a" : overallScore + "/100";
        List<String> warnings = new ArrayList<>();
        if (intensity == TrainingIntensity.HARD) {
            if (severity == AnomalySeverity.WARNING) {
                warnings.add("Minor recovery concerns detected. Consider slightly reducing workout volume "
                        + "or intensity if you feel fatigued.");
            }
            return new IntensityGuidance(intensity, List.of(4, 5), 45, 90,
                    List.of("intervals", "threshold", "vo2max", "hills", "tempo_intervals"),
                    "Your recovery score of " + score + " indicates excellent recovery. You're ready for "
                            + "high-intensity training focusing on improving fitness and performance.",
                    warnings, List.of(TrainingIntensity.MODERATE, TrainingIntensity.RECOVERY));
        }
        if (intensity == TrainingIntensity.MODERATE) {
            if (severity == AnomalySeverity.WARNING) {
                warnings.add("Some recovery metrics are below normal. Err on the side of easier effort if in doubt.");
            } else if (severity == AnomalySeverity.CRITICAL) {
                warnings.add("Critical recovery warning detected. Consider resting instead.");
            }
            return new IntensityGuidance(intensity, List.of(2, 3), 60, 150,
                    List.of("tempo", "steady_state", "aerobic", "long_slow_distance", "endurance"),
                    "Your recovery score of " + score + " suggests moderate recovery. Focus on steady-state "
                            + "aerobic work to build fitness while allowing continued adaptation.",
                    warnings, List.of(TrainingIntensity.HARD, TrainingIntensity.RECOVERY));
        }
        TrainingIntensity restTier = intensity == null ? TrainingIntensity.REST : intensity;
        if (severity == AnomalySeverity.CRITICAL) {
            warnings.add("CRITICAL: Multiple warning signs detected. Complete rest is strongly recommended. "
                    + "Monitor for illness symptoms.");
            return new IntensityGuidance(restTier, List.of(1), 0, 0, List.of("rest"),
                    "Recovery score of " + score + " with critical health warnings. Complete rest is essential. "
                            + "Do not train until metrics improve.",
                    warnings, List.of());
        }
        return new IntensityGuidance(restTier, List.of(1), 0, 60,
                List.of("recovery", "easy", "rest", "active_recovery", "mobility", "yoga"),
                "Your recovery score of " + score + " indicates you need rest. Prioritize recovery to avoid "
                        + "overtraining and maximize long-term performance gains.",
                warnings, List.of());
    }

    private TrainingIntensity tierFor(int overallScore) {
        if (overallScore >= RecoveryStatus.GREEN_THRESHOLD) {
            return TrainingIntensity.HARD;
        }
        if (overallScore >= RecoveryStatus.YELLOW_THRESHOLD) {
            return TrainingIntensity.MODERATE;
        }
        return TrainingIntensity.REST;
    }

    private TrainingIntensity adjustForAnomalies(TrainingIntensity base, AnomalySeverity severity) {
        if (severity == AnomalySeverity.CRITICAL) {
            return TrainingIntensity.REST;
        }
        if (severity == AnomalySeverity.WARNING) {
            if (base == TrainingIntensity.HARD) {
                return TrainingIntensity.MODERATE;
            }
            if (base == TrainingIntensity.MODERATE) {
                return TrainingIntensity.RECOVERY;
            }
        }
        return base;
    }
}
