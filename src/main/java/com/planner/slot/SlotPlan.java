package com.planner.slot;

import com.planner.core.ScheduledTask;
import com.planner.core.Task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schedules per named slot, in slot order, plus the tasks no slot took.
 */
public final class SlotPlan {

    /**
     * Reserved bucket name for tasks left out of every slot.
     */
    public static final String UNSCHEDULED = "Unscheduled";

    private final Map<String, List<ScheduledTask>> slots;
    private final List<Task> unscheduled;

    public SlotPlan(Map<String, List<ScheduledTask>> slots, List<Task> unscheduled) {
        this.slots = Collections.unmodifiableMap(new LinkedHashMap<>(slots));
        this.unscheduled = List.copyOf(unscheduled);
    }

    /**
     * Schedule of each slot, keyed by slot name in slot order.
     */
    public Map<String, List<ScheduledTask>> getSlots() {
        return slots;
    }

    public List<ScheduledTask> getSlot(String name) {
        return slots.getOrDefault(name, List.of());
    }

    public List<Task> getUnscheduled() {
        return unscheduled;
    }

    public int totalAllocatedMinutes() {
        return slots.values().stream()
                .flatMap(List::stream)
                .mapToInt(ScheduledTask::allocatedMinutes)
                .sum();
    }

    /**
     * The plan as a single mapping: each slot name to its scheduled tasks,
     * followed by {@value #UNSCHEDULED} to the tasks left over.
     */
    public Map<String, List<?>> asMap() {
        Map<String, List<?>> map = new LinkedHashMap<>(slots);
        map.put(UNSCHEDULED, unscheduled);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "SlotPlan{" +
                "slots=" + slots.keySet() +
                ", allocated=" + totalAllocatedMinutes() +
                ", unscheduled=" + unscheduled.size() +
                '}';
    }
}
