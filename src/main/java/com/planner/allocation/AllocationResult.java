package com.planner.allocation;

import com.planner.core.ScheduledTask;
import com.planner.core.Task;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one allocation call.
 *
 * @param scheduled       Tasks granted time, in schedule order
 * @param unscheduled     Tasks that received nothing, in priority order
 * @param budgetMinutes   Budget the call was made with
 * @param rejectionReason Why the input was rejected, or null when it was accepted
 */
public record AllocationResult(
        List<ScheduledTask> scheduled,
        List<Task> unscheduled,
        int budgetMinutes,
        String rejectionReason
) {
    public AllocationResult {
        scheduled = List.copyOf(scheduled);
        unscheduled = List.copyOf(unscheduled);
    }

    public static AllocationResult empty(int budgetMinutes, List<Task> unscheduled) {
        return new AllocationResult(List.of(), unscheduled, budgetMinutes, null);
    }

    public static AllocationResult rejected(int budgetMinutes, String reason) {
        return new AllocationResult(List.of(), List.of(), budgetMinutes, reason);
    }

    public boolean isRejected() {
        return rejectionReason != null;
    }

    public Optional<String> getRejectionReason() {
        return Optional.ofNullable(rejectionReason);
    }

    public int totalAllocatedMinutes() {
        return scheduled.stream().mapToInt(ScheduledTask::allocatedMinutes).sum();
    }

    public int remainingBudgetMinutes() {
        return Math.max(0, budgetMinutes - totalAllocatedMinutes());
    }

    public boolean isEmpty() {
        return scheduled.isEmpty();
    }
}
