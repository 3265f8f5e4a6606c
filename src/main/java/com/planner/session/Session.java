package com.planner.session;

import com.planner.core.Task;

import java.util.Optional;

/**
 * One block of a focus-session plan: a focus session on a task, or a break.
 *
 * @param type             Focus, short break or long break
 * @param position         1-based position in the whole plan, breaks included
 * @param task             Task worked on (null for breaks)
 * @param taskSessionIndex 1-based index of this session within its task (0 for breaks)
 * @param taskSessionCount Number of sessions the task needs (0 for breaks)
 * @param durationMinutes  Length of the block
 * @param note             Optional advice attached to the block
 */
public record Session(
        SessionType type,
        int position,
        Task task,
        int taskSessionIndex,
        int taskSessionCount,
        int durationMinutes,
        String note
) {
    static Session focus(int position, Task task, int index, int count, int minutes, String note) {
        return new Session(SessionType.FOCUS, position, task, index, count, minutes, note);
    }

    static Session rest(SessionType type, int position, int minutes) {
        return new Session(type, position, null, 0, 0, minutes, null);
    }

    public boolean isBreak() {
        return type.isBreak();
    }

    public Optional<Task> getTask() {
        return Optional.ofNullable(task);
    }

    public Optional<String> getNote() {
        return Optional.ofNullable(note);
    }
}
