package com.bko.readiness.recovery;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecoveryModelTest {

    @Test
    void componentScoresAreClamped() {
        ComponentScores scores = new ComponentScores(120, -5, null, 80);

        assertEquals(100, scores.hrvScore());
        assertEquals(0, scores.hrScore());
        assertNull(scores.sleepScore());
        assertEquals(3, scores.presentCount());
    }

    @Test
    void statusFollowsScoreAndSeverity() {
        assertEquals(RecoveryStatus.GREEN, RecoveryStatus.classify(70, AnomalySeverity.NONE));
        assertEquals(RecoveryStatus.YELLOW, RecoveryStatus.classify(85, AnomalySeverity.WARNING));
        assertEquals(RecoveryStatus.YELLOW, RecoveryStatus.classify(40, AnomalySeverity.NONE));
        assertEquals(RecoveryStatus.RED, RecoveryStatus.classify(39, AnomalySeverity.NONE));
        assertEquals(RecoveryStatus.RED, RecoveryStatus.classify(95, AnomalySeverity.CRITICAL));
    }

    @Test
    void labelsParseCaseInsensitively() {
        assertEquals(RecoveryStatus.GREEN, RecoveryStatus.fromLabel(" Green "));
        assertNull(RecoveryStatus.fromLabel("purple"));
        assertEquals(TrainingIntensity.RECOVERY, TrainingIntensity.fromLabel("RECOVERY"));
        assertNull(TrainingIntensity.fromLabel("extreme"));
        assertEquals(AnomalySeverity.NONE, AnomalySeverity.fromLabel(null));
        assertEquals(AnomalySeverity.WARNING, AnomalySeverity.fromLabel("unknown"));
    }

    @Test
    void severityOnlyEscalates() {
        assertEquals(AnomalySeverity.CRITICAL, AnomalySeverity.CRITICAL.escalate(AnomalySeverity.WARNING));
        assertEquals(AnomalySeverity.WARNING, AnomalySeverity.NONE.escalate(AnomalySeverity.WARNING));
        assertEquals(AnomalySeverity.WARNING, AnomalySeverity.WARNING.escalate(null));
    }

    @Test
    void recoveryScoreValidatesRange() {
        assertThrows(InvalidMetricException.class, () -> RecoveryScore.of(101, RecoveryStatus.GREEN));
        assertThrows(InvalidMetricException.class, () -> RecoveryScore.of(50, null));
        assertEquals(ComponentScores.EMPTY, RecoveryScore.of(50, RecoveryStatus.YELLOW).components());
    }

    @Test
    void anomalyResultCopiesItsLists() {
        List<String> warnings = new ArrayList<>(List.of("first"));
        AnomalyResult result = new AnomalyResult(true, AnomalySeverity.WARNING, warnings, null);
        warnings.add("second");

        assertEquals(List.of("first"), result.warnings());
        assertEquals(List.of(), result.recommendations());
        assertEquals("first", result.firstWarning());
    }
}
