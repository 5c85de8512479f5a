package com.bko.readiness.recovery;

import java.util.List;

public record AnomalyResult(
        boolean hasAnomalies,
        AnomalySeverity severity,
        List<String> warnings,
        List<String> recommendations
) {
    public static final AnomalyResult NONE = new AnomalyResult(false, AnomalySeverity.NONE, List.of(), List.of());

    public AnomalyResult {
        severity = severity == null ? AnomalySeverity.NONE : severity;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public String firstWarning() {
        return warnings.isEmpty() ? null : warnings.get(0);
    }
}
