package com.planner.session;

import java.util.List;

/**
 * Ordered focus sessions and breaks.
 *
 * @param sessions Blocks in the order they should be worked
 */
public record SessionPlan(List<Session> sessions) {

    public SessionPlan {
        sessions = List.copyOf(sessions);
    }

    public static SessionPlan empty() {
        return new SessionPlan(List.of());
    }

    public List<Session> focusSessions() {
        return sessions.stream().filter(s -> !s.isBreak()).toList();
    }

    public List<Session> breaks() {
        return sessions.stream().filter(Session::isBreak).toList();
    }

    public int totalFocusMinutes() {
        return focusSessions().stream().mapToInt(Session::durationMinutes).sum();
    }

    public int totalBreakMinutes() {
        return breaks().stream().mapToInt(Session::durationMinutes).sum();
    }

    public int totalMinutes() {
        return sessions.stream().mapToInt(Session::durationMinutes).sum();
    }

    public boolean isEmpty() {
        return sessions.isEmpty();
    }
}
