package com.planner.config;

/**
 * Configuration for the time allocator.
 *
 * @param minimumChunkMinutes Smallest partial allocation worth scheduling
 */
public record AllocationConfig(
        int minimumChunkMinutes
) {
    public static AllocationConfig defaults() {
        return new AllocationConfig(15);
    }
}
