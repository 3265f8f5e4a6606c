package com.planner.engine;

import com.planner.allocation.AllocationResult;
import com.planner.analysis.CompletionEstimate;
import com.planner.analysis.CompletionStats;
import com.planner.analysis.ScheduleDiagnostics;
import com.planner.config.SlotConfig;
import com.planner.core.ScheduledTask;
import com.planner.core.Task;
import com.planner.session.SessionPlan;
import com.planner.slot.SlotPlan;

import java.time.LocalDate;
import java.util.List;

/**
 * Entry point of the planner: pure functions from tasks and budgets to plans.
 * <p>
 * Operations never modify the given tasks and never throw for bad values;
 * structurally invalid input yields an empty (and, where applicable, rejected) result.
 * Completed tasks are ignored by every planning operation.
 */
public interface SchedulingEngine {

    /**
     * Sort the tasks and allocate the budget greedily.
     *
     * @param tasks            Tasks to plan
     * @param availableMinutes Time budget; negative budgets are rejected
     */
    AllocationResult generateSchedule(List<Task> tasks, int availableMinutes);

    /**
     * Fill the configured default slots in order.
     */
    SlotPlan planSlots(List<Task> tasks);

    /**
     * Fill the given slots in order.
     */
    SlotPlan planSlots(List<Task> tasks, List<SlotConfig> slots);

    /**
     * Focus-session plan with the configured session and break lengths.
     */
    SessionPlan planSessions(List<Task> tasks);

    /**
     * Focus-session plan with explicit session and break lengths.
     */
    SessionPlan planSessions(List<Task> tasks, int sessionLength, int breakLength);

    /**
     * Split a task using the configured maximum session length.
     */
    List<Task> splitTask(Task task);

    /**
     * Split a task into pieces of at most {@code maxSessionMinutes}.
     */
    List<Task> splitTask(Task task, int maxSessionMinutes);

    /**
     * Diagnostics of a produced schedule.
     */
    ScheduleDiagnostics analyze(AllocationResult result);

    /**
     * Diagnostics of an arbitrary schedule against a budget.
     */
    ScheduleDiagnostics analyze(List<ScheduledTask> schedule, int budgetMinutes);

    /**
     * Advice for the whole task set, active and completed.
     */
    List<String> recommend(List<Task> tasks);

    /**
     * Statistics over the completed tasks of the set.
     */
    CompletionStats completionStats(List<Task> tasks);

    /**
     * Completion projection for the active tasks of the set.
     */
    CompletionEstimate estimateCompletion(List<Task> tasks);

    /**
     * The date deadlines are measured against.
     */
    LocalDate today();
}
