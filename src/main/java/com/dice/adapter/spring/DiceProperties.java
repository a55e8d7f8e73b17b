package com.dice.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the dice engine.
 */
@ConfigurationProperties(prefix = "dice")
public class DiceProperties {

    /**
     * Whether the dice engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the dice configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:dice.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
