package com.planner.adapter.spring;

import com.planner.config.PlannerConfig;
import com.planner.engine.ScheduleWriter;
import com.planner.engine.SchedulingEngine;
import com.planner.exception.ConfigurationException;
import com.planner.repository.TaskRepository;
import com.planner.service.PlanningService;
import com.planner.suggestion.BreakSuggestionProvider;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class PlannerAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PlannerAutoConfiguration.class));

    @Test
    void shouldAutoConfigurePlannerBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(PlannerConfig.class);
            assertThat(context).hasSingleBean(SchedulingEngine.class);
            assertThat(context).hasSingleBean(BreakSuggestionProvider.class);
            assertThat(context).hasSingleBean(TaskRepository.class);
            assertThat(context).hasSingleBean(PlanningService.class);
            assertThat(context).hasSingleBean(ScheduleWriter.class);
            assertThat(context).hasSingleBean(PlannerProperties.class);
            assertThat(context.getBean(PlannerConfig.class).name()).isEqualTo("daily-planner");
        });
    }

    @Test
    void shouldLoadConfiguredPath() {
        contextRunner
                .withPropertyValues("planner.config-path=classpath:planner-test.yaml")
                .run(context -> assertThat(context.getBean(PlannerConfig.class).allocation().minimumChunkMinutes())
                        .isEqualTo(20));
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("planner.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(SchedulingEngine.class);
                    assertThat(context).doesNotHaveBean(PlanningService.class);
                });
    }

    @Test
    void shouldUseUserProvidedClock() {
        Clock fixed = Clock.fixed(Instant.parse("2025-08-02T10:00:00Z"), ZoneOffset.UTC);
        contextRunner
                .withBean(Clock.class, () -> fixed)
                .run(context -> assertThat(context.getBean(SchedulingEngine.class).today())
                        .isEqualTo(LocalDate.of(2025, 8, 2)));
    }

    @Test
    void shouldFailOnInvalidConfiguration() {
        contextRunner
                .withPropertyValues("planner.config-path=classpath:planner-invalid-tiers.yaml")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(ConfigurationException.class));
    }

    @Test
    void shouldRejectUnknownZone() {
        contextRunner
                .withPropertyValues("planner.zone=Not/AZone")
                .run(context -> assertThat(context).hasFailed());
    }
}
