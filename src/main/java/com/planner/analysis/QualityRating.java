package com.planner.analysis;

/**
 * Qualitative schedule rating, bucketed by share of the maximum quality points.
 */
public enum QualityRating {
    POOR,
    FAIR,
    GOOD,
    EXCELLENT;

    /**
     * poor below 40%, fair below 60%, good below 80%, excellent otherwise.
     */
    public static QualityRating fromPercentage(double percentage) {
        if (percentage < 40) {
            return POOR;
        }
        if (percentage < 60) {
            return FAIR;
        }
        if (percentage < 80) {
            return GOOD;
        }
        return EXCELLENT;
    }
}
