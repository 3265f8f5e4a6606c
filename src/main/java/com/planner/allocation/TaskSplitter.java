package com.planner.allocation;

import com.planner.config.SplitConfig;
import com.planner.core.Priority;
import com.planner.core.SplitInfo;
import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Breaks an oversized task into evenly sized pieces of at most
 * {@code maxSessionMinutes} each.
 */
public class TaskSplitter {

    private static final Logger log = LoggerFactory.getLogger(TaskSplitter.class);

    private final SplitConfig config;

    public TaskSplitter(SplitConfig config) {
        this.config = config;
    }

    public List<Task> split(Task task) {
        return split(task, config.maxSessionMinutes());
    }

    /**
     * Split a task into {@code ceil(estimate / maxSessionMinutes)} pieces.
     * Each piece gets {@code estimate / count} minutes and the last
     * {@code estimate % count} pieces one minute more, so the pieces add up to the
     * original estimate and none exceeds {@code maxSessionMinutes}.
     * A task that already fits is returned unchanged as a single-element list.
     *
     * @throws IllegalArgumentException if maxSessionMinutes is not positive
     */
    public List<Task> split(Task task, int maxSessionMinutes) {
        if (maxSessionMinutes <= 0) {
            throw new IllegalArgumentException("maxSessionMinutes must be positive, got " + maxSessionMinutes);
        }
        int estimate = task.getEstimatedMinutes();
        if (estimate <= maxSessionMinutes) {
            return List.of(task);
        }

        int count = (estimate + maxSessionMinutes - 1) / maxSessionMinutes;
        int perSession = estimate / count;
        int firstLonger = count - estimate % count + 1;
        String parentRef = task.reference();

        List<Task> pieces = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            int index = i;
            int minutes = i >= firstLonger ? perSession + 1 : perSession;
            Priority priority = i > 1 && config.demoteLaterSessions()
                    ? task.getPriority().demote()
                    : task.getPriority();
            pieces.add(task.toBuilder()
                    .id(task.getId().map(id -> id + "#" + index).orElse(null))
                    .title(task.getTitle() + " (Part " + i + "/" + count + ")")
                    .estimatedMinutes(minutes)
                    .priority(priority)
                    .splitInfo(new SplitInfo(parentRef, i, count))
                    .build());
        }

        log.debug("Split '{}' ({} min) into {} sessions of at most {} min",
                task.getTitle(), estimate, count, maxSessionMinutes);
        return pieces;
    }
}
