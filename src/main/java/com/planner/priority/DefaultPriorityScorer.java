package com.planner.priority;

import com.planner.config.ScoringConfig;
import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

/**
 * Scores a task as tier weight + deadline urgency - duration penalty.
 * <p>
 * The duration penalty is capped below the smallest urgency and tier gap,
 * and the smallest tier gap exceeds the largest urgency boost, so the order of
 * precedence is always: priority tier, then urgency, then duration.
 */
public class DefaultPriorityScorer implements PriorityScorer {

    private static final Logger log = LoggerFactory.getLogger(DefaultPriorityScorer.class);

    private final ScoringConfig config;

    public DefaultPriorityScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public double score(Task task, LocalDate today) {
        double base = config.tierWeight(task.getPriority());
        Urgency urgency = Urgency.of(task.getDeadline().orElse(null), today);
        double boost = urgencyBoost(urgency);
        double penalty = durationPenalty(task.getEstimatedMinutes());

        double score = base + boost - penalty;
        log.trace("Scored '{}': base={}, urgency={} (+{}), duration penalty={} -> {}",
                task.getTitle(), base, urgency, boost, penalty, score);
        return score;
    }

    /**
     * Urgency boost of a tier; {@link Urgency#NONE} adds nothing.
     */
    public double urgencyBoost(Urgency urgency) {
        return switch (urgency) {
            case OVERDUE -> config.overdueBoost();
            case DUE_TODAY -> config.dueTodayBoost();
            case DUE_WITHIN_3_DAYS -> config.dueSoonBoost();
            case DUE_WITHIN_7_DAYS -> config.dueThisWeekBoost();
            case NONE -> 0.0;
        };
    }

    double durationPenalty(int estimatedMinutes) {
        return Math.min(estimatedMinutes * config.durationPenaltyPerMinute(), config.maxDurationPenalty());
    }
}
