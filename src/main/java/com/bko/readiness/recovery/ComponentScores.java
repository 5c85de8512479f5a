package com.bko.readiness.recovery;

/**
 * Per-signal recovery scores. Any component may be absent when its signal had too little data;
 * present values are clamped to 0-100.
 */
public record ComponentScores(
        Integer hrvScore,
        Integer hrScore,
        Integer sleepScore,
        Integer acwrScore
) {
    public static final ComponentScores EMPTY = new ComponentScores(null, null, null, null);

    public ComponentScores {
        hrvScore = clamp(hrvScore);
        hrScore = clamp(hrScore);
        sleepScore = clamp(sleepScore);
        acwrScore = clamp(acwrScore);
    }

    public int presentCount() {
        int count = 0;
        for (Integer value : new Integer[]{hrvScore, hrScore, sleepScore, acwrScore}) {
            if (value != null) {
                count++;
            }
        }
        return count;
    }

    private static Integer clamp(Integer score) {
        if (score == null) {
            return null;
        }
        return Math.max(0, Math.min(100, score));
    }
}
