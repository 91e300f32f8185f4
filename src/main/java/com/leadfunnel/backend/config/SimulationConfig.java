package com.leadfunnel.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Random source for simulated engagement metrics. Set ad-simulator.seed to make
 * simulated runs reproducible.
 */
@Configuration
@Slf4j
public class SimulationConfig {

    @Bean
    public Random engagementRandom(@Value("${ad-simulator.seed:#{null}}") Long seed) {
        if (seed != null) {
            log.info("Simulated engagement uses fixed seed {}", seed);
            return new Random(seed);
        }
        return new Random();
    }
}
