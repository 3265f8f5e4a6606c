package com.planner.config;

/**
 * Configuration for splitting oversized tasks.
 *
 * @param maxSessionMinutes    Longest piece a task may be split into
 * @param demoteLaterSessions  Lower the priority tier of every piece after the first
 */
public record SplitConfig(
        int maxSessionMinutes,
        boolean demoteLaterSessions
) {
    public static SplitConfig defaults() {
        return new SplitConfig(90, true);
    }
}
