package com.planner.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the planner.
 */
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    /**
     * Whether the planner beans are registered.
     */
    private boolean enabled = true;

    /**
     * Path to the planner YAML file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:planner.yaml";

    /**
     * Zone used to determine "today" for deadline urgency. Empty means the system zone.
     */
    private String zone;

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

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }
}
