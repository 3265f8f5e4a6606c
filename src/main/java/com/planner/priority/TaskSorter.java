package com.planner.priority;

import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders tasks most urgent/important first using {@link PriorityKey}.
 * The result is a total order, so identical input always sorts identically.
 */
public class TaskSorter {

    private static final Logger log = LoggerFactory.getLogger(TaskSorter.class);

    private final PriorityScorer scorer;

    public TaskSorter(PriorityScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Sort a copy of the given tasks; the input list is left untouched.
     */
    public List<Task> sort(List<Task> tasks, LocalDate today) {
        if (tasks == null || tasks.isEmpty()) {
            return List.of();
        }

        List<Ranked> ranked = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            PriorityKey key = new PriorityKey(scorer.score(task, today), task.getEstimatedMinutes(), i);
            ranked.add(new Ranked(task, key));
        }
        ranked.sort(Comparator.comparing(Ranked::key));

        List<Task> sorted = ranked.stream().map(Ranked::task).toList();
        log.debug("Sorted {} tasks, first: '{}'", sorted.size(), sorted.get(0).getTitle());
        return sorted;
    }

    private record Ranked(Task task, PriorityKey key) {
    }
}
