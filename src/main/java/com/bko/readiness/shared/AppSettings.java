package com.bko.readiness.shared;

public record AppSettings(EngineSettings engine) {
    public AppSettings {
        if (engine == null) {
            engine = new EngineSettings(null, null);
        }
    }

    public String defaultSport() {
        return engine.defaultSport();
    }

    public boolean isRandomSeedConfigured() {
        return engine.hasRandomSeed();
    }
}
