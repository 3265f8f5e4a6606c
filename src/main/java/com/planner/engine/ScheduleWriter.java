package com.planner.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.planner.allocation.AllocationResult;
import com.planner.analysis.CompletionEstimate;
import com.planner.analysis.CompletionStats;
import com.planner.analysis.ScheduleDiagnostics;
import com.planner.core.Priority;
import com.planner.core.ScheduledTask;
import com.planner.core.Task;
import com.planner.core.TaskFactory;
import com.planner.exception.PlannerException;
import com.planner.session.Session;
import com.planner.session.SessionPlan;
import com.planner.slot.SlotPlan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders planner results as plain structured data (maps and lists) and JSON,
 * using snake_case field names.
 */
public class ScheduleWriter {

    private final ObjectMapper objectMapper;

    public ScheduleWriter() {
        this(false);
    }

    public ScheduleWriter(boolean pretty) {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(SerializationFeature.INDENT_OUTPUT, pretty);
    }

    public Map<String, Object> toMap(Task task) {
        Map<String, Object> map = new LinkedHashMap<>();
        task.getId().ifPresent(id -> map.put(TaskFactory.FIELD_ID, id));
        map.put(TaskFactory.FIELD_TITLE, task.getTitle());
        map.put(TaskFactory.FIELD_ESTIMATED_TIME, task.getEstimatedMinutes());
        map.put(TaskFactory.FIELD_PRIORITY, task.getPriority().level());
        map.put(TaskFactory.FIELD_DEADLINE, task.getDeadline().map(Object::toString).orElse(null));
        map.put(TaskFactory.FIELD_COMPLETED, task.isCompleted());
        task.getActualMinutes().ifPresent(m -> map.put(TaskFactory.FIELD_ACTUAL_TIME, m));
        task.getSplitInfo().ifPresent(split -> {
            map.put("parent", split.parentRef());
            map.put("session_index", split.sessionIndex());
            map.put("session_count", split.sessionCount());
        });
        return map;
    }

    public Map<String, Object> toMap(ScheduledTask scheduled) {
        Map<String, Object> map = toMap(scheduled.task());
        map.put("allocated_time", scheduled.allocatedMinutes());
        map.put("remaining_time", scheduled.remainingMinutes());
        map.put("completion_percentage", scheduled.completionPercentage());
        map.put("schedule_order", scheduled.scheduleOrder());
        if (scheduled.isPartial()) {
            map.put("partial", true);
        }
        map.put("recommended_break", scheduled.recommendedBreakMinutes());
        map.put("break_suggestion", scheduled.breakSuggestion());
        return map;
    }

    public Map<String, Object> toMap(AllocationResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("schedule", result.scheduled().stream().map(this::toMap).toList());
        map.put("unscheduled", result.unscheduled().stream().map(this::toMap).toList());
        map.put("available_time", result.budgetMinutes());
        map.put("total_allocated", result.totalAllocatedMinutes());
        result.getRejectionReason().ifPresent(reason -> map.put("error", reason));
        return map;
    }

    public Map<String, Object> toMap(SlotPlan plan) {
        Map<String, Object> map = new LinkedHashMap<>();
        plan.getSlots().forEach((name, schedule) ->
                map.put(name, schedule.stream().map(this::toMap).toList()));
        map.put(SlotPlan.UNSCHEDULED, plan.getUnscheduled().stream().map(this::toMap).toList());
        return map;
    }

    public Map<String, Object> toMap(Session session) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("position", session.position());
        map.put("type", session.type().name().toLowerCase(Locale.ROOT));
        map.put("duration", session.durationMinutes());
        session.getTask().ifPresent(task -> {
            map.put(TaskFactory.FIELD_TITLE, task.getTitle());
            task.getId().ifPresent(id -> map.put("task_id", id));
            map.put("session_index", session.taskSessionIndex());
            map.put("session_count", session.taskSessionCount());
        });
        session.getNote().ifPresent(note -> map.put("note", note));
        return map;
    }

    public List<Map<String, Object>> toList(SessionPlan plan) {
        return plan.sessions().stream().map(this::toMap).toList();
    }

    public Map<String, Object> toMap(ScheduleDiagnostics diagnostics) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_allocated", diagnostics.totalAllocatedMinutes());
        map.put("available_time", diagnostics.budgetMinutes());
        map.put("time_utilization", diagnostics.utilizationPercentage());
        map.put("priority_weighted_score", diagnostics.priorityWeightedScore());
        map.put("quality_points", diagnostics.qualityPoints());
        map.put("schedule_quality", diagnostics.rating().name().toLowerCase(Locale.ROOT));
        return map;
    }

    public Map<String, Object> toMap(CompletionStats stats) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_completed", stats.totalCompleted());
        map.put("total_time_spent", stats.totalMinutesSpent());
        map.put("avg_completion_time", stats.averageMinutesPerTask());
        map.put("completion_by_priority", byPriority(stats.completedByPriority()));
        map.put("productivity_score", stats.productivityScore());
        return map;
    }

    public Map<String, Object> toMap(CompletionEstimate estimate) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_time", estimate.totalMinutes());
        map.put("adjusted_time", estimate.adjustedMinutes());
        map.put("days_needed", estimate.daysNeeded());
        map.put("estimated_completion", estimate.getEstimatedCompletion().map(Object::toString).orElse(null));
        map.put("priority_breakdown", byPriority(estimate.minutesByPriority()));
        return map;
    }

    /**
     * Serialize any value produced by this writer (or a planner record) to JSON.
     */
    public String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(toPlainData(value));
        } catch (JsonProcessingException e) {
            throw new PlannerException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private Object toPlainData(Object value) {
        if (value instanceof AllocationResult r) return toMap(r);
        if (value instanceof SlotPlan p) return toMap(p);
        if (value instanceof SessionPlan p) return toList(p);
        if (value instanceof ScheduleDiagnostics d) return toMap(d);
        if (value instanceof CompletionStats s) return toMap(s);
        if (value instanceof CompletionEstimate e) return toMap(e);
        if (value instanceof ScheduledTask st) return toMap(st);
        if (value instanceof Task t) return toMap(t);
        if (value instanceof List<?> list) return list.stream().map(this::toPlainData).toList();
        return value;
    }

    private static Map<String, Integer> byPriority(Map<Priority, Integer> values) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (Priority p : Priority.values()) {
            map.put(p.name().toLowerCase(Locale.ROOT), values.getOrDefault(p, 0));
        }
        return map;
    }
}
