package com.planner.config;

/**
 * Configuration for focus-session (Pomodoro) plans.
 *
 * @param sessionLength       Length of a focus session in minutes
 * @param breakLength         Length of a short break in minutes
 * @param longBreakEvery      A long break follows every N-th focus session
 * @param longBreakMultiplier Long break = breakLength * multiplier
 */
public record SessionConfig(
        int sessionLength,
        int breakLength,
        int longBreakEvery,
        int longBreakMultiplier
) {
    public static SessionConfig defaults() {
        return new SessionConfig(25, 5, 4, 3);
    }

    public SessionConfig withLengths(int sessionLength, int breakLength) {
        return new SessionConfig(sessionLength, breakLength, longBreakEvery, longBreakMultiplier);
    }

    public int longBreakLength() {
        return breakLength * longBreakMultiplier;
    }
}
