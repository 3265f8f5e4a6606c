package com.planner.slot;

import com.planner.allocation.AllocationResult;
import com.planner.allocation.TimeAllocator;
import com.planner.config.SlotConfig;
import com.planner.core.ScheduledTask;
import com.planner.core.Task;
import com.planner.priority.TaskSorter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills a sequence of slots one after another.
 * <p>
 * Each slot sorts and allocates the tasks not claimed by an earlier slot.
 * A task that receives any time in a slot, even partially, is claimed for the
 * whole plan: its remainder is not offered to later slots. A task instance listed
 * more than once gives up one entry per scheduled occurrence.
 */
public class MultiSlotPlanner {

    private static final Logger log = LoggerFactory.getLogger(MultiSlotPlanner.class);

    private final TaskSorter sorter;
    private final TimeAllocator allocator;

    public MultiSlotPlanner(TaskSorter sorter, TimeAllocator allocator) {
        this.sorter = sorter;
        this.allocator = allocator;
    }

    public SlotPlan plan(List<Task> tasks, List<SlotConfig> slots, LocalDate today) {
        if (tasks == null || tasks.isEmpty()) {
            return new SlotPlan(emptySlots(slots), List.of());
        }

        Map<String, List<ScheduledTask>> schedules = new LinkedHashMap<>();
        List<Task> remaining = new ArrayList<>(tasks);

        for (SlotConfig slot : slots) {
            if (!isUsable(slot, schedules)) {
                continue;
            }
            if (remaining.isEmpty()) {
                schedules.put(slot.name(), List.of());
                continue;
            }

            AllocationResult result = allocator.allocate(sorter.sort(remaining, today), slot.minutes());
            schedules.put(slot.name(), result.scheduled());

            result.scheduled().forEach(st -> claim(remaining, st.task()));

            log.debug("Slot '{}' ({} min): {} tasks, {} min allocated, {} tasks left",
                    slot.name(), slot.minutes(), result.scheduled().size(),
                    result.totalAllocatedMinutes(), remaining.size());
        }

        return new SlotPlan(schedules, remaining);
    }

    /**
     * Removes one entry of the scheduled task, matched by identity, so a task
     * listed twice keeps its second entry until that one is scheduled as well.
     */
    private static void claim(List<Task> remaining, Task scheduled) {
        for (int i = 0; i < remaining.size(); i++) {
            if (remaining.get(i) == scheduled) {
                remaining.remove(i);
                return;
            }
        }
    }

    private boolean isUsable(SlotConfig slot, Map<String, List<ScheduledTask>> seen) {
        if (slot == null || slot.name() == null || slot.name().isBlank()) {
            log.warn("Ignoring slot without a name");
            return false;
        }
        if (SlotPlan.UNSCHEDULED.equals(slot.name())) {
            log.warn("Ignoring slot using the reserved name '{}'", SlotPlan.UNSCHEDULED);
            return false;
        }
        if (seen.containsKey(slot.name())) {
            log.warn("Ignoring duplicate slot '{}'", slot.name());
            return false;
        }
        return true;
    }

    private Map<String, List<ScheduledTask>> emptySlots(List<SlotConfig> slots) {
        Map<String, List<ScheduledTask>> schedules = new LinkedHashMap<>();
        for (SlotConfig slot : slots) {
            if (isUsable(slot, schedules)) {
                schedules.put(slot.name(), List.of());
            }
        }
        return schedules;
    }
}
