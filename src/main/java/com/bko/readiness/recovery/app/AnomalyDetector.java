package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.AnomalyResult;
import com.bko.readiness.recovery.AnomalySeverity;
import com.bko.readiness.recovery.ComponentScores;
import com.bko.readiness.recovery.HealthSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Flags readings that point at illness or overtraining: a sharp HRV drop, a resting HR spike, a bad
 * night, a training load spike, all three core signals poor at once, or HRV suppressed for three
 * days running. Rules are independent; the result carries the most severe one that fired.
 */
@Component
public class AnomalyDetector {
    private static final Logger logger = LoggerFactory.getLogger(AnomalyDetector.class);

    static final double HRV_CRITICAL_DROP = -20.0;
    static final double HRV_WARNING_DROP = -15.0;
    static final double HR_CRITICAL_RISE = 10.0;
    static final double HR_WARNING_RISE = 7.0;
    static final int POOR_SLEEP_SCORE = 40;
    static final int LOW_ACWR_SCORE = 30;
    static final int SUPPRESSED_DAYS = 3;

    private static final String EASY_TRAINING = "Easy training or active recovery only.";

    private final List<AnomalyRule> rules = List.of(
            new AnomalyRule("hrv-critical-drop",
                    signals -> signals.hrvDeviation() != null && signals.hrvDeviation() <= HRV_CRITICAL_DROP,
                    AnomalySeverity.CRITICAL,
                    signals -> "Critical HRV drop detected: " + percent(signals.hrvDeviation())
                            + " below baseline. Possible illness or severe fatigue.",
                    signals -> "Consider complete rest. Monitor for illness symptoms."),
            new AnomalyRule("hrv-warning-drop",
                    AnomalyDetector::hrvInWarningBand,
                    AnomalySeverity.WARNING,
                    signals -> "HRV below normal: " + percent(signals.hrvDeviation())
                            + " below baseline. Recovery may be compromised.",
                    signals -> EASY_TRAINING),
            new AnomalyRule("hr-critical-rise",
                    signals -> signals.hrDeviation() != null && signals.hrDeviation() >= HR_CRITICAL_RISE,
                    AnomalySeverity.CRITICAL,
                    signals -> "Elevated resting HR: " + percent(signals.hrDeviation())
                            + " above baseline. Possible illness, stress, or overtraining.",
                    signals -> "Prioritize rest and stress management. Monitor symptoms."),
            new AnomalyRule("hr-warning-rise",
                    signals -> signals.hrDeviation() != null
                            && signals.hrDeviation() >= HR_WARNING_RISE
                            && signals.hrDeviation() < HR_CRITICAL_RISE,
                    AnomalySeverity.WARNING,
                    signals -> "Resting HR elevated: " + percent(signals.hrDeviation())
                            + " above baseline. Increased stress or fatigue.",
                    signals -> hrvInWarningBand(signals) ? null : "Reduce training intensity."),
            new AnomalyRule("poor-sleep",
                    signals -> below(signals.components().sleepScore(), POOR_SLEEP_SCORE),
                    AnomalySeverity.WARNING,
                    signals -> "Poor sleep detected: Sleep score " + signals.components().sleepScore()
                            + "/100. Inadequate recovery.",
                    signals -> "Prioritize sleep hygiene and an earlier bedtime."),
            new AnomalyRule("multiple-signals",
                    signals -> below(signals.components().hrvScore(), 25)
                            && below(signals.components().hrScore(), 25)
                            && below(signals.components().sleepScore(), 50),
                    AnomalySeverity.CRITICAL,
                    signals -> "Multiple warning signals: Low HRV + Elevated HR + Poor sleep. "
                            + "High risk of illness or overtraining.",
                    signals -> "PRIORITY: Complete rest until metrics improve."),
            new AnomalyRule("training-load",
                    signals -> below(signals.components().acwrScore(), LOW_ACWR_SCORE),
                    AnomalySeverity.WARNING,
                    signals -> signals.components().acwrScore() == 0
                            ? "Training load alarm: ACWR score 0/100. Load has moved far outside the safe range."
                            : "Training load warning: ACWR score " + signals.components().acwrScore()
                            + "/100. Risk of injury from a training spike or of detraining.",
                    signals -> signals.components().acwrScore() == 0
                            ? "Immediately reduce training load to prevent injury."
                            : "Adjust training volume to safer levels."),
            new AnomalyRule("persistent-hrv-suppression",
                    Signals::persistentSuppression,
                    AnomalySeverity.CRITICAL,
                    signals -> "Overtraining pattern detected: Persistent HRV suppression over multiple days.",
                    signals -> "Schedule a recovery week with reduced volume and intensity.")
    );

    public AnomalyResult detect(HealthSample today, List<HealthSample> history, ComponentScores components) {
        Signals signals = readSignals(today, history == null ? List.of() : history,
                components == null ? ComponentScores.EMPTY : components);

        AnomalySeverity severity = AnomalySeverity.NONE;
        Set<String> warnings = new LinkedHashSet<>();
        Set<String> recommendations = new LinkedHashSet<>();
        for (AnomalyRule rule : rules) {
            if (!rule.trigger().test(signals)) {
                continue;
            }
            logger.debug("Anomaly rule {} fired ({})", rule.name(), rule.severity());
            severity = severity.escalate(rule.severity());
            warnings.add(rule.warning().apply(signals));
            String recommendation = rule.recommendation().apply(signals);
            if (recommendation != null) {
                recommendations.add(recommendation);
            }
        }

        if (severity != AnomalySeverity.NONE) {
            logger.info("Detected {} anomaly severity with {} warning(s)", severity, warnings.size());
        }
        return new AnomalyResult(!warnings.isEmpty(), severity, new ArrayList<>(warnings), new ArrayList<>(recommendations));
    }

    private Signals readSignals(HealthSample today, List<HealthSample> history, ComponentScores components) {
        Double hrvDeviation = null;
        Double hrDeviation = null;
        if (today != null) {
            Double hrvBaseline = RollingBaseline.average(history, HealthSample::hrvMs);
            if (today.hasHrv() && hrvBaseline != null) {
                hrvDeviation = RollingBaseline.deviationPercent(today.hrvMs(), hrvBaseline);
            }
            Double hrBaseline = RollingBaseline.average(history, HealthSample::restingHrValue);
            if (today.hasRestingHr() && hrBaseline != null) {
                hrDeviation = RollingBaseline.deviationPercent(today.restingHr(), hrBaseline);
            }
        }
        return new Signals(hrvDeviation, hrDeviation, components, isHrvPersistentlySuppressed(history));
    }

    /**
     * Looks at the last seven days: the earliest four set a baseline, and each of the last three
     * must sit at least 15% under it.
     */
    static boolean isHrvPersistentlySuppressed(List<HealthSample> history) {
        if (history.size() < RollingBaseline.WINDOW_DAYS) {
            return false;
        }
        List<HealthSample> week = history.subList(history.size() - RollingBaseline.WINDOW_DAYS, history.size());
        double sum = 0.0;
        int valid = 0;
        for (HealthSample sample : week.subList(0, 4)) {
            if (sample != null && sample.hasHrv()) {
                sum += sample.hrvMs();
                valid++;
            }
        }
        if (valid < 3) {
            return false;
        }
        double baseline = sum / valid;
        int suppressed = 0;
        for (HealthSample sample : week.subList(week.size() - SUPPRESSED_DAYS, week.size())) {
            if (sample != null && sample.hasHrv()
                    && RollingBaseline.deviationPercent(sample.hrvMs(), baseline) <= HRV_WARNING_DROP) {
                suppressed++;
            }
        }
        return suppressed >= SUPPRESSED_DAYS;
    }

    private static boolean hrvInWarningBand(Signals signals) {
        return signals.hrvDeviation() != null
                && signals.hrvDeviation() <= HRV_WARNING_DROP
                && signals.hrvDeviation() > HRV_CRITICAL_DROP;
    }

    private static boolean below(Integer score, int threshold) {
        return score != null && score < threshold;
    }

    private static String percent(double deviation) {
        return String.format(Locale.US, "%.1f%%", deviation);
    }

    record Signals(Double hrvDeviation, Double hrDeviation, ComponentScores components, boolean persistentSuppression) {
    }

    record AnomalyRule(String name,
                       Predicate<Signals> trigger,
                       AnomalySeverity severity,
                       Function<Signals, String> warning,
                       Function<Signals, String> recommendation) {
    }
}
