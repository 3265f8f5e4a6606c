package com.planner.service;

import com.planner.allocation.AllocationResult;
import com.planner.analysis.CompletionEstimate;
import com.planner.analysis.CompletionStats;
import com.planner.analysis.ScheduleDiagnostics;
import com.planner.config.SlotConfig;
import com.planner.core.Task;
import com.planner.engine.SchedulingEngine;
import com.planner.repository.TaskRepository;
import com.planner.session.SessionPlan;
import com.planner.slot.SlotPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Plans over the tasks held in a {@link TaskRepository}.
 * Reads a snapshot of the repository per call and hands it to the engine.
 */
public class PlanningService {

    private static final Logger log = LoggerFactory.getLogger(PlanningService.class);

    private final TaskRepository repository;
    private final SchedulingEngine engine;

    public PlanningService(TaskRepository repository, SchedulingEngine engine) {
        this.repository = repository;
        this.engine = engine;
    }

    public AllocationResult schedule(int availableMinutes) {
        List<Task> active = repository.findActive();
        log.info("Scheduling {} active tasks into {} minutes", active.size(), availableMinutes);
        return engine.generateSchedule(active, availableMinutes);
    }

    public SlotPlan planDay() {
        return engine.planSlots(repository.findActive());
    }

    public SlotPlan planDay(List<SlotConfig> slots) {
        return engine.planSlots(repository.findActive(), slots);
    }

    public SessionPlan planSessions(int sessionLength, int breakLength) {
        return engine.planSessions(repository.findActive(), sessionLength, breakLength);
    }

    public ScheduleDiagnostics diagnostics(int availableMinutes) {
        return engine.analyze(schedule(availableMinutes));
    }

    public List<String> recommendations() {
        return engine.recommend(repository.findAll());
    }

    public CompletionStats completionStats() {
        return engine.completionStats(repository.findCompleted());
    }

    public CompletionEstimate completionEstimate() {
        return engine.estimateCompletion(repository.findActive());
    }
}
