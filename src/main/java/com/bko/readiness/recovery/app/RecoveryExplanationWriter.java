package com.bko.readiness.recovery.app;

import com.bko.readiness.recovery.AnomalyResult;
import com.bko.readiness.recovery.ComponentScores;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class RecoveryExplanationWriter {
    private static final String BULLET = "  • ";

    public String write(int overallScore, ComponentScores components, AnomalyResult anomalies) {
        List<String> lines = new ArrayList<>();
        addHeadline(lines, overallScore);

        lines.add("");
        lines.add("Component scores:");
        addComponent(lines, "HRV", components.hrvScore(), RecoveryAggregator.Weight.HRV);
        addComponent(lines, "Resting HR", components.hrScore(), RecoveryAggregator.Weight.RESTING_HR);
        addComponent(lines, "Sleep", components.sleepScore(), RecoveryAggregator.Weight.SLEEP);
        addComponent(lines, "Training load", components.acwrScore(), RecoveryAggregator.Weight.ACWR);

        if (anomalies.hasAnomalies()) {
            lines.add("");
            lines.add("Health alerts:");
            anomalies.warnings().forEach(warning -> lines.add(BULLET + warning));
        }
        if (!anomalies.recommendations().isEmpty()) {
            lines.add("");
            lines.add("Recommendations:");
            anomalies.recommendations().forEach(recommendation -> lines.add(BULLET + recommendation));
        }
        return String.join("\n", lines);
    }

    private void addHeadline(List<String> lines, int score) {
        if (score >= 90) {
            lines.add("Excellent recovery (Score: " + score + "/100)");
            lines.add("You're well-recovered and ready for high-intensity training or racing.");
        } else if (score >= 70) {
            lines.add("Good recovery (Score: " + score + "/100)");
            lines.add("You're recovered and ready for normal training loads.");
        } else if (score >= 50) {
            lines.add("Moderate recovery (Score: " + score + "/100)");
            lines.add("Consider easier training or active recovery today.");
        } else if (score >= 30) {
            lines.add("Poor recovery (Score: " + score + "/100)");
            lines.add("Light activity or rest is recommended to avoid overtraining.");
        } else {
            lines.add("Critical, low recovery (Score: " + score + "/100)");
            lines.add("Complete rest is strongly recommended.");
        }
    }

    private void addComponent(List<String> lines, String label, Integer score, RecoveryAggregator.Weight weight) {
        if (score != null) {
            lines.add(BULLET + label + ": " + score + "/100 (" + Math.round(weight.value() * 100) + "% weight)");
        }
    }
}
