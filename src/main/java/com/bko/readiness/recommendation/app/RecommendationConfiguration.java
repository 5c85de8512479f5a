package com.bko.readiness.recommendation.app;

import com.bko.readiness.shared.AppSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class RecommendationConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationConfiguration.class);

    @Bean
    public RandomSource randomSource(AppSettings appSettings) {
        if (appSettings.isRandomSeedConfigured()) {
            Long seed = appSettings.engine().randomSeed();
            logger.info("Workout type selection seeded with {}", seed);
            return new JdkRandomSource(new Random(seed));
        }
        return new JdkRandomSource(new Random());
    }
}
