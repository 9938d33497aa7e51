package com.calc.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the calculator.
 */
@ConfigurationProperties(prefix = "calc")
public class CalcProperties {

    /**
     * Whether the calculator beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the calculator configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:calc.yaml";

    /**
     * Whether the application runs the interactive shell on standard input.
     */
    private boolean interactive = true;

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

    public boolean isInteractive() {
        return interactive;
    }

    public void setInteractive(boolean interactive) {
        this.interactive = interactive;
    }
}
