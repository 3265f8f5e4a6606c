package com.planner.session;

import com.planner.config.SessionConfig;
import com.planner.core.Task;
import com.planner.priority.TaskSorter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Packs tasks, in priority order, into fixed-length focus sessions separated by breaks.
 * <p>
 * A task needs {@code ceil(estimate / sessionLength)} sessions; its last session
 * holds what is left. Every focus session except the final one of the plan is
 * followed by a break, long after every {@code longBreakEvery}-th focus session
 * and short otherwise.
 */
public class SessionPlanner {

    private static final Logger log = LoggerFactory.getLogger(SessionPlanner.class);

    private final TaskSorter sorter;
    private final SessionConfig defaults;

    public SessionPlanner(TaskSorter sorter, SessionConfig defaults) {
        this.sorter = sorter;
        this.defaults = defaults;
    }

    public SessionPlan plan(List<Task> tasks, LocalDate today) {
        return plan(tasks, defaults, today);
    }

    public SessionPlan plan(List<Task> tasks, int sessionLength, int breakLength, LocalDate today) {
        return plan(tasks, defaults.withLengths(sessionLength, breakLength), today);
    }

    public SessionPlan plan(List<Task> tasks, SessionConfig config, LocalDate today) {
        if (config.sessionLength() <= 0 || config.breakLength() < 0) {
            log.warn("Rejecting session plan with session length {} and break length {}",
                    config.sessionLength(), config.breakLength());
            return SessionPlan.empty();
        }
        if (tasks == null || tasks.isEmpty()) {
            return SessionPlan.empty();
        }

        List<Task> ordered = sorter.sort(tasks, today);
        int sessionLength = config.sessionLength();
        int totalFocus = ordered.stream()
                .mapToInt(t -> sessionsNeeded(t.getEstimatedMinutes(), sessionLength))
                .sum();

        List<Session> sessions = new ArrayList<>();
        int focusCount = 0;
        for (Task task : ordered) {
            int estimate = task.getEstimatedMinutes();
            int needed = sessionsNeeded(estimate, sessionLength);
            for (int i = 1; i <= needed; i++) {
                int minutes = i < needed ? sessionLength : estimate - sessionLength * (needed - 1);
                String note = i == 1 && needed > 1
                        ? "Consider breaking down '" + task.getTitle() + "' - it's longer than a single session"
                        : null;
                sessions.add(Session.focus(sessions.size() + 1, task, i, needed, minutes, note));
                focusCount++;

                if (focusCount < totalFocus) {
                    boolean longBreak = focusCount % config.longBreakEvery() == 0;
                    sessions.add(Session.rest(
                            longBreak ? SessionType.LONG_BREAK : SessionType.SHORT_BREAK,
                            sessions.size() + 1,
                            longBreak ? config.longBreakLength() : config.breakLength()));
                }
            }
        }

        SessionPlan plan = new SessionPlan(sessions);
        log.debug("Planned {} focus sessions ({} min) and {} breaks ({} min) for {} tasks",
                focusCount, plan.totalFocusMinutes(), sessions.size() - focusCount,
                plan.totalBreakMinutes(), ordered.size());
        return plan;
    }

    static int sessionsNeeded(int estimate, int sessionLength) {
        return (estimate + sessionLength - 1) / sessionLength;
    }
}
