package com.planner.priority;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Deadline urgency tiers, most urgent first.
 */
public enum Urgency {
    OVERDUE,
    DUE_TODAY,
    DUE_WITHIN_3_DAYS,
    DUE_WITHIN_7_DAYS,
    NONE;

    /**
     * Classify a deadline relative to today. A missing deadline is {@link #NONE}.
     */
    public static Urgency of(LocalDate deadline, LocalDate today) {
        if (deadline == null) {
            return NONE;
        }
        long days = ChronoUnit.DAYS.between(today, deadline);
        if (days < 0) {
            return OVERDUE;
        }
        if (days == 0) {
            return DUE_TODAY;
        }
        if (days <= 3) {
            return DUE_WITHIN_3_DAYS;
        }
        if (days <= 7) {
            return DUE_WITHIN_7_DAYS;
        }
        return NONE;
    }
}
