package com.planner.config;

import java.util.List;

/**
 * A named, independently budgeted scheduling window.
 *
 * @param name    Slot name (unique within a plan)
 * @param minutes Time budget of the slot
 */
public record SlotConfig(
        String name,
        int minutes
) {
    /**
     * Morning, afternoon and evening windows of 120, 90 and 60 minutes.
     */
    public static List<SlotConfig> defaults() {
        return List.of(
                new SlotConfig("Morning Focus", 120),
                new SlotConfig("Afternoon Work", 90),
                new SlotConfig("Evening Tasks", 60)
        );
    }
}
