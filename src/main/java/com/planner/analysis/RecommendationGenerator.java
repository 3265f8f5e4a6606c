package com.planner.analysis;

import com.planner.config.RecommendationConfig;
import com.planner.core.Priority;
import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Short advice derived from a whole task set, active and completed.
 * Every trigger is evaluated in a fixed order and the first
 * {@code maxRecommendations} messages are kept.
 */
public class RecommendationGenerator {

    private static final Logger log = LoggerFactory.getLogger(RecommendationGenerator.class);

    public static final String EMPTY_TASK_SET =
            "Start by adding some tasks to get organized!";
    public static final String ALL_GOOD =
            "Great job! Your task management looks well-organized.";

    private final RecommendationConfig config;

    public RecommendationGenerator(RecommendationConfig config) {
        this.config = config;
    }

    public List<String> generate(List<Task> tasks, LocalDate today) {
        if (tasks == null || tasks.isEmpty()) {
            return List.of(EMPTY_TASK_SET);
        }

        List<Task> active = tasks.stream().filter(t -> !t.isCompleted()).toList();
        long completed = tasks.size() - active.size();
        List<String> messages = new ArrayList<>();

        long overdue = active.stream().filter(t -> t.isOverdue(today)).count();
        if (overdue > 0) {
            messages.add("You have " + overdue
                    + " overdue task(s). Consider rescheduling or prioritizing them.");
        }

        long dueSoon = active.stream().filter(t -> isDueSoon(t, today)).count();
        if (dueSoon > 0) {
            messages.add("You have " + dueSoon + " task(s) due within " + config.dueSoonDays()
                    + " days. Consider prioritizing them in your schedule.");
        }

        if (active.size() > config.maxActiveTasks()) {
            messages.add("You have " + active.size()
                    + " active tasks. Consider focusing on fewer tasks at a time.");
        } else if (active.size() < config.minActiveTasks()) {
            messages.add("You only have " + active.size()
                    + " active task(s). Plan ahead by adding upcoming work.");
        }

        long high = active.stream().filter(t -> t.getPriority() == Priority.HIGH).count();
        if (high > config.maxHighPriorityTasks()) {
            messages.add("You have many high-priority tasks. Consider reviewing priorities to focus on what's truly urgent.");
        } else if (high == 0 && !active.isEmpty()) {
            messages.add("None of your tasks is marked high priority. Identify what matters most today.");
        }

        int totalMinutes = active.stream().mapToInt(Task::getEstimatedMinutes).sum();
        if (totalMinutes > config.dailyMinutesLimit()) {
            messages.add("Your tasks require significant time. Consider spreading them across multiple days.");
        }

        double completionRate = (double) completed / tasks.size();
        if (completionRate < config.lowCompletionRate()) {
            messages.add("Your completion rate is low. Try finishing a few small tasks to build momentum.");
        } else if (completionRate > config.highCompletionRate()) {
            messages.add("Excellent completion rate! Keep up the great work.");
        }

        long withDeadline = active.stream().filter(t -> t.getDeadline().isPresent()).count();
        if (!active.isEmpty() && withDeadline * 2 < active.size()) {
            messages.add("Many tasks don't have deadlines. Setting deadlines can improve time management and motivation.");
        }

        long longTasks = active.stream().filter(t -> t.getEstimatedMinutes() > config.longTaskMinutes()).count();
        if (longTasks * 3 > active.size()) {
            messages.add("Consider breaking down large tasks into smaller, more manageable chunks for better productivity.");
        }

        if (messages.isEmpty()) {
            return List.of(ALL_GOOD);
        }
        log.debug("Generated {} recommendations for {} tasks ({} active)", messages.size(), tasks.size(), active.size());
        return List.copyOf(messages.subList(0, Math.min(messages.size(), config.maxRecommendations())));
    }

    private boolean isDueSoon(Task task, LocalDate today) {
        return task.getDeadline()
                .map(d -> ChronoUnit.DAYS.between(today, d))
                .filter(days -> days >= 0 && days <= config.dueSoonDays())
                .isPresent();
    }
}
