package com.bko.readiness.engine;

public interface ReadinessUseCase {
    ReadinessReport evaluate(ReadinessRequest request);
}
