package com.planner.session;

/**
 * Kind of block in a focus-session plan.
 */
public enum SessionType {
    FOCUS,
    SHORT_BREAK,
    LONG_BREAK;

    public boolean isBreak() {
        return this != FOCUS;
    }
}
