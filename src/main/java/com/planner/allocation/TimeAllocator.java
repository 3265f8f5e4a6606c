package com.planner.allocation;

import com.planner.config.AllocationConfig;
import com.planner.core.ScheduledTask;
import com.planner.core.Task;
import com.planner.suggestion.BreakPolicy;
import com.planner.suggestion.BreakSuggestionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy allocation of a time budget over tasks that are already sorted.
 * <p>
 * Walking the tasks in order while budget remains:
 * 1. A task that fits is granted its full estimate.
 * 2. Otherwise, if at least the minimum chunk remains, the task gets the rest
 *    of the budget as a partial allocation and the walk ends.
 * 3. Otherwise the task is skipped and a later, shorter task may still fit.
 * <p>
 * At most one partial allocation happens per call.
 */
public class TimeAllocator {

    private static final Logger log = LoggerFactory.getLogger(TimeAllocator.class);

    private final AllocationConfig config;
    private final BreakSuggestionProvider suggestions;

    public TimeAllocator(AllocationConfig config, BreakSuggestionProvider suggestions) {
        this.config = config;
        this.suggestions = suggestions;
    }

    /**
     * @param sortedTasks   Tasks in priority order
     * @param budgetMinutes Available minutes
     * @return Scheduled tasks and the tasks left without time
     */
    public AllocationResult allocate(List<Task> sortedTasks, int budgetMinutes) {
        if (budgetMinutes < 0) {
            log.warn("Rejecting allocation with negative budget: {}", budgetMinutes);
            return AllocationResult.rejected(budgetMinutes, "Budget cannot be negative: " + budgetMinutes);
        }
        if (sortedTasks == null || sortedTasks.isEmpty()) {
            return AllocationResult.empty(budgetMinutes, List.of());
        }
        if (budgetMinutes == 0) {
            return AllocationResult.empty(budgetMinutes, sortedTasks);
        }

        int minimumChunk = config.minimumChunkMinutes();
        int remaining = budgetMinutes;
        List<ScheduledTask> scheduled = new ArrayList<>();
        List<Task> unscheduled = new ArrayList<>();

        for (Task task : sortedTasks) {
            if (remaining <= 0) {
                unscheduled.add(task);
                continue;
            }

            int estimate = task.getEstimatedMinutes();
            int granted;
            if (estimate <= remaining) {
                granted = estimate;
            } else if (remaining >= minimumChunk) {
                granted = remaining;
                log.trace("Partial allocation for '{}': {} of {} min", task.getTitle(), granted, estimate);
            } else {
                log.trace("Skipping '{}' ({} min): only {} min left, below minimum chunk of {}",
                        task.getTitle(), estimate, remaining, minimumChunk);
                unscheduled.add(task);
                continue;
            }

            remaining -= granted;
            scheduled.add(annotate(task, granted, scheduled.size() + 1));
        }

        AllocationResult result = new AllocationResult(scheduled, unscheduled, budgetMinutes, null);
        log.debug("Allocated {} of {} min to {} tasks ({} unscheduled)",
                result.totalAllocatedMinutes(), budgetMinutes, scheduled.size(), unscheduled.size());
        return result;
    }

    private ScheduledTask annotate(Task task, int granted, int order) {
        int breakMinutes = BreakPolicy.recommendedBreakMinutes(granted);
        return new ScheduledTask(task, granted, order, breakMinutes, suggestions.suggest(breakMinutes, order));
    }
}
