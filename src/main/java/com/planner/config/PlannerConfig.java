package com.planner.config;

import java.util.List;

/**
 * Root configuration of the planner.
 *
 * @param name            Planner name identifier
 * @param version         Configuration version
 * @param scoring         Priority score constants
 * @param allocation      Allocator settings
 * @param split           Task splitter settings
 * @param sessions        Focus-session settings
 * @param slots           Default slots for multi-slot plans
 * @param recommendations Advisory thresholds
 * @param estimation      Completion estimate settings
 */
public record PlannerConfig(
        String name,
        String version,
        ScoringConfig scoring,
        AllocationConfig allocation,
        SplitConfig split,
        SessionConfig sessions,
        List<SlotConfig> slots,
        RecommendationConfig recommendations,
        EstimationConfig estimation
) {
    /**
     * Get slot config by name.
     */
    public SlotConfig getSlot(String slotName) {
        return slots.stream()
                .filter(s -> s.name().equals(slotName))
                .findFirst()
                .orElse(null);
    }

    public static PlannerConfig defaults() {
        return new PlannerConfig(
                "default-planner",
                "1.0",
                ScoringConfig.defaults(),
                AllocationConfig.defaults(),
                SplitConfig.defaults(),
                SessionConfig.defaults(),
                SlotConfig.defaults(),
                RecommendationConfig.defaults(),
                EstimationConfig.defaults()
        );
    }
}
