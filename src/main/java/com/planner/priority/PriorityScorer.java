package com.planner.priority;

import com.planner.core.Task;

import java.time.LocalDate;

/**
 * Turns a task into a single orderable score.
 * Higher scores are scheduled first. Implementations must be pure functions of
 * the task and the given date.
 */
public interface PriorityScorer {

    /**
     * @param task  Task to score
     * @param today Reference date for deadline urgency
     * @return Composite score (higher = more urgent/important)
     */
    double score(Task task, LocalDate today);
}
