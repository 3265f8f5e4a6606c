package com.planner.suggestion;

/**
 * Recommended break length after a block of work.
 */
public final class BreakPolicy {

    private BreakPolicy() {
    }

    /**
     * 5 minutes after less than 45 minutes of work, 10 after less than 90, otherwise 15.
     */
    public static int recommendedBreakMinutes(int workedMinutes) {
        if (workedMinutes < 45) {
            return 5;
        }
        if (workedMinutes < 90) {
            return 10;
        }
        return 15;
    }
}
