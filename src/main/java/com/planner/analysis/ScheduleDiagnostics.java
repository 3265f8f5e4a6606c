package com.planner.analysis;

/**
 * Read-only metrics derived from a produced schedule.
 *
 * @param totalAllocatedMinutes Sum of allocated time
 * @param budgetMinutes         Budget the schedule was made for
 * @param utilizationPercentage Allocated time as a share of the budget (0..100)
 * @param priorityWeightedScore Priority-weighted allocated time as a share of budget * 3 (0..100)
 * @param qualityPoints         Composite quality points (0..100)
 * @param rating                Bucketed quality points
 */
public record ScheduleDiagnostics(
        int totalAllocatedMinutes,
        int budgetMinutes,
        double utilizationPercentage,
        double priorityWeightedScore,
        double qualityPoints,
        QualityRating rating
) {
    public static ScheduleDiagnostics empty(int budgetMinutes) {
        return new ScheduleDiagnostics(0, budgetMinutes, 0.0, 0.0, 0.0, QualityRating.POOR);
    }
}
