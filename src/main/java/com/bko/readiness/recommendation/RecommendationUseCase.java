package com.bko.readiness.recommendation;

public interface RecommendationUseCase {
    /**
     * Turns a day's recovery picture into a workout: intensity, session type and structure, a
     * rationale, and up to four alternatives.
     */
    RecommendationResult recommend(RecommendationRequest request);
}
