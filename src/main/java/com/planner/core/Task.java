package com.planner.core;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * A pending or completed work item.
 * Immutable; the planner copies and annotates tasks but never changes them.
 */
public final class Task {

    private final String id;
    private final String title;
    private final int estimatedMinutes;
    private final Priority priority;
    private final LocalDate deadline;
    private final boolean completed;
    private final Integer actualMinutes;
    private final SplitInfo splitInfo;

    private Task(Builder builder) {
        if (builder.title == null || builder.title.isBlank()) {
            throw new IllegalArgumentException("Task title cannot be blank");
        }
        if (builder.estimatedMinutes <= 0) {
            throw new IllegalArgumentException(
                    "Estimated duration must be positive, got " + builder.estimatedMinutes);
        }
        this.id = builder.id;
        this.title = builder.title;
        this.estimatedMinutes = builder.estimatedMinutes;
        this.priority = Objects.requireNonNull(builder.priority, "priority cannot be null");
        this.deadline = builder.deadline;
        this.completed = builder.completed;
        this.actualMinutes = builder.actualMinutes;
        this.splitInfo = builder.splitInfo;
    }

    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public String getTitle() {
        return title;
    }

    public int getEstimatedMinutes() {
        return estimatedMinutes;
    }

    public Priority getPriority() {
        return priority;
    }

    public Optional<LocalDate> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Minutes actually spent, when recorded.
     */
    public Optional<Integer> getActualMinutes() {
        return Optional.ofNullable(actualMinutes);
    }

    public Optional<SplitInfo> getSplitInfo() {
        return Optional.ofNullable(splitInfo);
    }

    /**
     * Identifier used to refer back to this task: its id, or its title when it has none.
     */
    public String reference() {
        return id != null ? id : title;
    }

    public boolean isOverdue(LocalDate today) {
        return deadline != null && deadline.isBefore(today);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .estimatedMinutes(estimatedMinutes)
                .priority(priority)
                .deadline(deadline)
                .completed(completed)
                .actualMinutes(actualMinutes)
                .splitInfo(splitInfo);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Task task = (Task) o;
        return estimatedMinutes == task.estimatedMinutes &&
                completed == task.completed &&
                Objects.equals(id, task.id) &&
                title.equals(task.title) &&
                priority == task.priority &&
                Objects.equals(deadline, task.deadline) &&
                Objects.equals(actualMinutes, task.actualMinutes) &&
                Objects.equals(splitInfo, task.splitInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, estimatedMinutes, priority, deadline, completed, actualMinutes, splitInfo);
    }

    @Override
    public String toString() {
        return "Task{" +
                (id != null ? "id='" + id + "', " : "") +
                "title='" + title + '\'' +
                ", estimated=" + estimatedMinutes +
                ", priority=" + priority +
                (deadline != null ? ", deadline=" + deadline : "") +
                (completed ? ", completed" : "") +
                (splitInfo != null ? ", split=" + splitInfo.sessionIndex() + "/" + splitInfo.sessionCount() : "") +
                '}';
    }

    /**
     * Builder for Task.
     */
    public static class Builder {
        private String id;
        private String title;
        private int estimatedMinutes;
        private Priority priority = Priority.MEDIUM;
        private LocalDate deadline;
        private boolean completed;
        private Integer actualMinutes;
        private SplitInfo splitInfo;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder estimatedMinutes(int estimatedMinutes) {
            this.estimatedMinutes = estimatedMinutes;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder deadline(LocalDate deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder completed(boolean completed) {
            this.completed = completed;
            return this;
        }

        public Builder actualMinutes(Integer actualMinutes) {
            this.actualMinutes = actualMinutes;
            return this;
        }

        public Builder splitInfo(SplitInfo splitInfo) {
            this.splitInfo = splitInfo;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
