package com.planner.config;

/**
 * Thresholds for the task-set advisories.
 *
 * @param maxRecommendations    Maximum number of messages returned
 * @param maxActiveTasks        More active tasks than this is "too many"
 * @param minActiveTasks        Fewer active tasks than this is "too few"
 * @param maxHighPriorityTasks  More high-priority active tasks than this is an overload
 * @param dailyMinutesLimit     Total active estimate above this should span several days
 * @param lowCompletionRate     Completion rate below this (0..1) is flagged
 * @param highCompletionRate    Completion rate above this (0..1) is praised
 * @param longTaskMinutes       Tasks estimated above this count as long
 * @param dueSoonDays           Tasks due within this many days are flagged
 */
public record RecommendationConfig(
        int maxRecommendations,
        int maxActiveTasks,
        int minActiveTasks,
        int maxHighPriorityTasks,
        int dailyMinutesLimit,
        double lowCompletionRate,
        double highCompletionRate,
        int longTaskMinutes,
        int dueSoonDays
) {
    public static RecommendationConfig defaults() {
        return new RecommendationConfig(5, 20, 3, 5, 480, 0.3, 0.8, 120, 2);
    }
}
