package com.planner.priority;

import java.util.Objects;

/**
 * Combined sort key for one task in one sorting call.
 * <p>
 * Comparison order:
 * 1. Score (higher = earlier)
 * 2. Estimated duration (shorter = earlier)
 * 3. Input position (earlier input = earlier, keeps the order stable)
 */
public final class PriorityKey implements Comparable<PriorityKey> {

    private final double score;
    private final int estimatedMinutes;
    private final int inputIndex;

    public PriorityKey(double score, int estimatedMinutes, int inputIndex) {
        this.score = score;
        this.estimatedMinutes = estimatedMinutes;
        this.inputIndex = inputIndex;
    }

    @Override
    public int compareTo(PriorityKey other) {
        // 1. Higher score first
        int scoreCmp = Double.compare(other.score, this.score);
        if (scoreCmp != 0) {
            return scoreCmp;
        }

        // 2. Shorter task first
        int durationCmp = Integer.compare(this.estimatedMinutes, other.estimatedMinutes);
        if (durationCmp != 0) {
            return durationCmp;
        }

        // 3. Input order
        return Integer.compare(this.inputIndex, other.inputIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PriorityKey that = (PriorityKey) o;
        return Double.compare(score, that.score) == 0 &&
                estimatedMinutes == that.estimatedMinutes &&
                inputIndex == that.inputIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, estimatedMinutes, inputIndex);
    }

    @Override
    public String toString() {
        return "PriorityKey{" +
                "score=" + score +
                ", estimated=" + estimatedMinutes +
                ", index=" + inputIndex +
                '}';
    }
}
