package com.bko.readiness.recovery;

import java.time.LocalDate;

/**
 * Result of scoring one day: the component breakdown, the aggregated score when at least two
 * components were computable (otherwise {@code null}), and the anomaly findings.
 */
public record RecoveryAssessment(
        LocalDate date,
        ComponentScores components,
        RecoveryScore score,
        AnomalyResult anomalies
) {
    public RecoveryAssessment {
        components = components == null ? ComponentScores.EMPTY : components;
        anomalies = anomalies == null ? AnomalyResult.NONE : anomalies;
    }

    public boolean hasScore() {
        return score != null;
    }
}
