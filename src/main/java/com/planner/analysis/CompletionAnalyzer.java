package com.planner.analysis;

import com.planner.config.EstimationConfig;
import com.planner.core.Priority;
import com.planner.core.Task;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Completion statistics for finished work and completion estimates for open work.
 */
public class CompletionAnalyzer {

    private final EstimationConfig config;

    public CompletionAnalyzer(EstimationConfig config) {
        this.config = config;
    }

    /**
     * Productivity score is {@code min(100, completed * 10 + min(hoursSpent, 40))}.
     * Tasks not marked completed are ignored.
     */
    public CompletionStats stats(List<Task> tasks) {
        List<Task> completed = tasks == null ? List.of()
                : tasks.stream().filter(Task::isCompleted).toList();
        Map<Priority, Integer> byPriority = zeroByPriority();
        if (completed.isEmpty()) {
            return new CompletionStats(0, 0, 0.0, byPriority, 0.0);
        }

        int spent = 0;
        for (Task task : completed) {
            spent += task.getActualMinutes().orElse(task.getEstimatedMinutes());
            byPriority.merge(task.getPriority(), 1, Integer::sum);
        }
        double average = (double) spent / completed.size();
        double productivity = Math.min(100.0, completed.size() * 10 + Math.min(spent / 60.0, 40.0));

        return new CompletionStats(completed.size(), spent, round(average), byPriority, round(productivity));
    }

    /**
     * Completed tasks are ignored.
     */
    public CompletionEstimate estimate(List<Task> tasks, LocalDate today) {
        List<Task> active = tasks == null ? List.of()
                : tasks.stream().filter(t -> !t.isCompleted()).toList();
        Map<Priority, Integer> byPriority = zeroByPriority();
        if (active.isEmpty()) {
            return new CompletionEstimate(0, 0, 0.0, null, byPriority);
        }

        int total = 0;
        for (Task task : active) {
            total += task.getEstimatedMinutes();
            byPriority.merge(task.getPriority(), task.getEstimatedMinutes(), Integer::sum);
        }
        double adjusted = total / config.efficiencyFactor();
        double days = adjusted / config.dailyCapacityMinutes();
        LocalDate completion = today.plusDays((long) days + 1);

        return new CompletionEstimate(total, (int) Math.round(adjusted), round(days), completion, byPriority);
    }

    private static Map<Priority, Integer> zeroByPriority() {
        Map<Priority, Integer> map = new EnumMap<>(Priority.class);
        for (Priority p : Priority.values()) {
            map.put(p, 0);
        }
        return map;
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
