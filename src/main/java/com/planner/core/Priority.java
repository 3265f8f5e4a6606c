package com.planner.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Priority tier of a task.
 * <p>
 * {@code level} is the wire value (1 = highest), {@code weight} is the
 * multiplier used when valuing allocated time.
 */
public enum Priority {

    HIGH(1, 3),
    MEDIUM(2, 2),
    LOW(3, 1);

    private final int level;
    private final int weight;

    Priority(int level, int weight) {
        this.level = level;
        this.weight = weight;
    }

    public int level() {
        return level;
    }

    public int weight() {
        return weight;
    }

    /**
     * One tier lower, never below {@link #LOW}.
     */
    public Priority demote() {
        return switch (this) {
            case HIGH -> MEDIUM;
            case MEDIUM, LOW -> LOW;
        };
    }

    public static Optional<Priority> fromLevel(int level) {
        for (Priority p : values()) {
            if (p.level == level) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * Parse a wire value: a level number (1/2/3) or a tier name in any case.
     */
    public static Optional<Priority> parse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Priority p) {
            return Optional.of(p);
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                return Optional.empty();
            }
            return fromLevel((int) d);
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return fromLevel(Integer.parseInt(text));
        } catch (NumberFormatException ignored) {
            // not numeric, try the tier name
        }
        try {
            return Optional.of(valueOf(text.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
