package com.dice.adapter.spring;

import com.dice.config.ConfigLoader;
import com.dice.config.DiceConfig;
import com.dice.engine.DiceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the dice engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "dice", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DiceProperties.class)
public class DiceAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DiceAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public DiceConfig diceConfig(DiceProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public DiceEngine diceEngine(DiceConfig config) {
        log.info("Creating DiceEngine with {} allowed die sizes", config.allowedSides().size());
        return new DiceEngine(config);
    }
}
