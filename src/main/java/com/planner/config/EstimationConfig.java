package com.planner.config;

/**
 * Configuration for completion-date estimates.
 *
 * @param dailyCapacityMinutes Productive minutes per day
 * @param efficiencyFactor     Share of time actually spent working (0..1], accounts for interruptions
 */
public record EstimationConfig(
        int dailyCapacityMinutes,
        double efficiencyFactor
) {
    public static EstimationConfig defaults() {
        return new EstimationConfig(360, 0.8);
    }
}
