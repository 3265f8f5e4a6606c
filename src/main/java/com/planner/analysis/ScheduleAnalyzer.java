package com.planner.analysis;

import com.planner.core.Priority;
import com.planner.core.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Computes efficiency and quality metrics for a schedule.
 * <p>
 * Quality points (100 max): 30 when all three priority tiers are present,
 * 30 when there is both a short (30 min or less) and a long (over 90 min)
 * allocation, and up to 40 in proportion to the average completion percentage.
 */
public class ScheduleAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ScheduleAnalyzer.class);

    static final double TIER_MIX_POINTS = 30;
    static final double LENGTH_MIX_POINTS = 30;
    static final double COMPLETION_POINTS = 40;
    static final double MAX_POINTS = TIER_MIX_POINTS + LENGTH_MIX_POINTS + COMPLETION_POINTS;

    static final int SHORT_ALLOCATION_MINUTES = 30;
    static final int LONG_ALLOCATION_MINUTES = 90;

    public ScheduleDiagnostics analyze(List<ScheduledTask> schedule, int budgetMinutes) {
        if (schedule == null || schedule.isEmpty()) {
            return ScheduleDiagnostics.empty(budgetMinutes);
        }

        int allocated = schedule.stream().mapToInt(ScheduledTask::allocatedMinutes).sum();
        double utilization = 0.0;
        double weighted = 0.0;
        if (budgetMinutes > 0) {
            utilization = Math.min(100.0, allocated * 100.0 / budgetMinutes);
            int weightedMinutes = schedule.stream()
                    .mapToInt(st -> st.allocatedMinutes() * st.priority().weight())
                    .sum();
            double maxWeighted = (double) budgetMinutes * Priority.HIGH.weight();
            weighted = Math.min(100.0, weightedMinutes * 100.0 / maxWeighted);
        }

        double points = qualityPoints(schedule);
        QualityRating rating = QualityRating.fromPercentage(points * 100.0 / MAX_POINTS);

        ScheduleDiagnostics diagnostics = new ScheduleDiagnostics(
                allocated, budgetMinutes, round(utilization), round(weighted), round(points), rating);
        log.debug("Schedule diagnostics: {}", diagnostics);
        return diagnostics;
    }

    private double qualityPoints(List<ScheduledTask> schedule) {
        double points = 0;

        Set<Priority> tiers = EnumSet.noneOf(Priority.class);
        schedule.forEach(st -> tiers.add(st.priority()));
        if (tiers.size() == Priority.values().length) {
            points += TIER_MIX_POINTS;
        }

        boolean hasShort = schedule.stream().anyMatch(st -> st.allocatedMinutes() <= SHORT_ALLOCATION_MINUTES);
        boolean hasLong = schedule.stream().anyMatch(st -> st.allocatedMinutes() > LONG_ALLOCATION_MINUTES);
        if (hasShort && hasLong) {
            points += LENGTH_MIX_POINTS;
        }

        double avgCompletion = schedule.stream()
                .mapToDouble(ScheduledTask::completionPercentage)
                .average()
                .orElse(0.0);
        points += COMPLETION_POINTS * avgCompletion / 100.0;
        return points;
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
