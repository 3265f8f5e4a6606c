package com.planner.config;

import com.planner.core.Priority;

/**
 * Constants of the composite priority score (higher = schedule earlier).
 *
 * @param highWeight               Base value of a High task
 * @param mediumWeight             Base value of a Medium task
 * @param lowWeight                Base value of a Low task
 * @param overdueBoost             Urgency added when the deadline has passed
 * @param dueTodayBoost            Urgency added when due today
 * @param dueSoonBoost             Urgency added when due within 3 days
 * @param dueThisWeekBoost         Urgency added when due within 7 days
 * @param durationPenaltyPerMinute Penalty per estimated minute (shorter tasks first)
 * @param maxDurationPenalty       Cap of the duration penalty
 */
public record ScoringConfig(
        double highWeight,
        double mediumWeight,
        double lowWeight,
        double overdueBoost,
        double dueTodayBoost,
        double dueSoonBoost,
        double dueThisWeekBoost,
        double durationPenaltyPerMinute,
        double maxDurationPenalty
) {
    public static ScoringConfig defaults() {
        return new ScoringConfig(100, 50, 10, 30, 20, 10, 5, 0.01, 0.5);
    }

    public double tierWeight(Priority priority) {
        return switch (priority) {
            case HIGH -> highWeight;
            case MEDIUM -> mediumWeight;
            case LOW -> lowWeight;
        };
    }

    /**
     * Smallest distance between two adjacent priority tiers.
     */
    public double minTierGap() {
        return Math.min(highWeight - mediumWeight, mediumWeight - lowWeight);
    }

    /**
     * Smallest distance between two adjacent urgency tiers, "no deadline" (0) included.
     */
    public double minUrgencyGap() {
        return Math.min(
                Math.min(overdueBoost - dueTodayBoost, dueTodayBoost - dueSoonBoost),
                Math.min(dueSoonBoost - dueThisWeekBoost, dueThisWeekBoost));
    }
}
