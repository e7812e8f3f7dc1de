package com.rummikub.config;

import com.rummikub.engine.TurnEngine;
import com.rummikub.service.GameNameGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * 引擎装配
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TurnEngine turnEngine(Clock clock, RummikubProperties properties) {
        return new TurnEngine(clock, new SecureRandom(), properties.getRackSize());
    }

    @Bean
    public GameNameGenerator gameNameGenerator() {
        return new GameNameGenerator(new SecureRandom());
    }
}
