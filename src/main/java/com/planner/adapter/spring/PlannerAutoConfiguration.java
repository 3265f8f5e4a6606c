package com.planner.adapter.spring;

import com.planner.config.ConfigLoader;
import com.planner.config.PlannerConfig;
import com.planner.engine.DefaultSchedulingEngine;
import com.planner.engine.ScheduleWriter;
import com.planner.engine.SchedulingEngine;
import com.planner.exception.ConfigurationException;
import com.planner.repository.InMemoryTaskRepository;
import com.planner.repository.TaskRepository;
import com.planner.service.PlanningService;
import com.planner.suggestion.BreakSuggestionProvider;
import com.planner.suggestion.RotatingBreakSuggestionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Spring Boot auto-configuration for the planner.
 */
@Configuration
@ConditionalOnProperty(prefix = "planner", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PlannerProperties.class)
public class PlannerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PlannerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PlannerConfig plannerConfig(PlannerProperties properties) {
        log.info("Loading planner configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock plannerClock(PlannerProperties properties) {
        String zone = properties.getZone();
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        try {
            return Clock.system(ZoneId.of(zone.trim()));
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid planner.zone: " + zone, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public BreakSuggestionProvider breakSuggestionProvider() {
        return new RotatingBreakSuggestionProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulingEngine schedulingEngine(PlannerConfig config, Clock plannerClock,
                                             BreakSuggestionProvider breakSuggestionProvider) {
        log.info("Creating SchedulingEngine: {}", config.name());
        return new DefaultSchedulingEngine(config, plannerClock, breakSuggestionProvider);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRepository taskRepository() {
        return new InMemoryTaskRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public PlanningService planningService(TaskRepository taskRepository, SchedulingEngine schedulingEngine) {
        return new PlanningService(taskRepository, schedulingEngine);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleWriter scheduleWriter() {
        return new ScheduleWriter(true);
    }
}
