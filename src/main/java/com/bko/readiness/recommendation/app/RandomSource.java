package com.bko.readiness.recommendation.app;

import java.util.List;

/**
 * Source of the only non-deterministic choice in the recommender: which of several equally
 * eligible workout types to suggest.
 */
@FunctionalInterface
public interface RandomSource {
    /**
     * @return a value in {@code [0, bound)}
     */
    int nextInt(int bound);

    default <T> T pick(List<T> options) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("Nothing to pick from");
        }
        return options.get(nextInt(options.size()));
    }
}
