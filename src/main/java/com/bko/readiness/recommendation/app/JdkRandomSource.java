package com.bko.readiness.recommendation.app;

import java.util.Random;

class JdkRandomSource implements RandomSource {
    private final Random random;

    JdkRandomSource(Random random) {
        this.random = random;
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
