package com.bko.readiness.shared;

public record EngineSettings(String defaultSport, Long randomSeed) {
    public static final String GENERAL_SPORT = "general";

    public EngineSettings {
        defaultSport = hasText(defaultSport) ? defaultSport.trim().toLowerCase() : GENERAL_SPORT;
    }

    public boolean hasRandomSeed() {
        return randomSeed != null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
