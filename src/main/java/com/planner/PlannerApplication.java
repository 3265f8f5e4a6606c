package com.planner;

import com.planner.allocation.AllocationResult;
import com.planner.core.Task;
import com.planner.core.TaskFactory;
import com.planner.engine.ScheduleWriter;
import com.planner.repository.TaskRepository;
import com.planner.service.PlanningService;
import com.planner.session.SessionPlan;
import com.planner.slot.SlotPlan;
import com.planner.spring.EnablePlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Example Spring Boot application demonstrating planner usage.
 */
@SpringBootApplication
@EnablePlanner
public class PlannerApplication {

    private static final Logger log = LoggerFactory.getLogger(PlannerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PlannerApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(TaskRepository repository, PlanningService planning, ScheduleWriter writer,
                                  Clock clock) {
        return args -> {
            log.info("=== Planner Demo Started ===");

            LocalDate today = LocalDate.now(clock);
            String json = """
                [
                    {"title": "Write quarterly report", "estimated_time": 150, "priority": 1, "deadline": "%s"},
                    {"title": "Review pull requests", "estimated_time": 45, "priority": 2, "deadline": "%s"},
                    {"title": "Reply to emails", "estimated_time": 20, "priority": 3},
                    {"title": "Plan team offsite", "estimated_time": 60, "priority": "low", "deadline": "%s"},
                    {"title": "Fix login bug", "estimated_time": 30, "priority": "high", "completed": true, "actual_time": 40}
                ]
                """.formatted(today.plusDays(1), today.minusDays(1), today.plusDays(10));
            List<Task> tasks = TaskFactory.parseTasks(json);
            tasks.forEach(repository::save);
            log.info("Seeded {} tasks", tasks.size());

            AllocationResult schedule = planning.schedule(180);
            schedule.scheduled().forEach(st -> log.info("#{} {} -> {} of {} min, then {} min break: {}",
                    st.scheduleOrder(), st.title(), st.allocatedMinutes(), st.task().getEstimatedMinutes(),
                    st.recommendedBreakMinutes(), st.breakSuggestion()));
            schedule.unscheduled().forEach(t -> log.info("Unscheduled: {}", t.getTitle()));

            SlotPlan day = planning.planDay();
            day.getSlots().forEach((slot, entries) -> log.info("{}: {} tasks", slot, entries.size()));

            SessionPlan sessions = planning.planSessions(25, 5);
            log.info("Session plan: {} focus sessions, {} min total",
                    sessions.focusSessions().size(), sessions.totalMinutes());

            log.info("Diagnostics: {}", planning.diagnostics(180));
            planning.recommendations().forEach(r -> log.info("Recommendation: {}", r));
            log.info("Completion estimate: {}", writer.writeJson(planning.completionEstimate()));
            log.info("Schedule JSON:\n{}", writer.writeJson(schedule));

            log.info("=== Planner Demo Finished ===");
        };
    }
}
