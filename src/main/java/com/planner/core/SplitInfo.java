package com.planner.core;

/**
 * Marks a task as one piece of a larger task that was split into sessions.
 *
 * @param parentRef    Identifier of the original task (its id, or its title when it has none)
 * @param sessionIndex 1-based index of this piece
 * @param sessionCount Total number of pieces
 */
public record SplitInfo(
        String parentRef,
        int sessionIndex,
        int sessionCount
) {
    public SplitInfo {
        if (sessionCount < 1 || sessionIndex < 1 || sessionIndex > sessionCount) {
            throw new IllegalArgumentException(
                    "Invalid split position " + sessionIndex + "/" + sessionCount);
        }
    }
}
