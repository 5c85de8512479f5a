package com.bko.readiness.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SettingsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SettingsConfiguration.class);

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        EngineSettings engine = new EngineSettings(
                envConfig.get("engine.default_sport"),
                parseSeed(envConfig.get("engine.random_seed"))
        );
        logger.info("Readiness engine configured with default sport '{}'{}", engine.defaultSport(),
                engine.hasRandomSeed() ? " and a fixed random seed" : "");
        return new AppSettings(engine);
    }

    private Long parseSeed(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring ENGINE_RANDOM_SEED '{}': not a number", value);
            return null;
        }
    }
}
