package com.planner.slot;

import com.planner.allocation.TimeAllocator;
import com.planner.config.AllocationConfig;
import com.planner.config.ScoringConfig;
import com.planner.config.SlotConfig;
import com.planner.core.Priority;
import com.planner.core.ScheduledTask;
import com.planner.core.Task;
import com.planner.priority.DefaultPriorityScorer;
import com.planner.priority.TaskSorter;
import com.planner.suggestion.RotatingBreakSuggestionProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MultiSlotPlanner and SlotPlan.
 */
class MultiSlotPlannerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 8, 2);

    private MultiSlotPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new MultiSlotPlanner(
                new TaskSorter(new DefaultPriorityScorer(ScoringConfig.defaults())),
                new TimeAllocator(AllocationConfig.defaults(), new RotatingBreakSuggestionProvider()));
    }

    private static Task task(String title, Priority priority, int minutes) {
        return Task.builder().title(title).estimatedMinutes(minutes).priority(priority).build();
    }

    private static List<String> titles(List<ScheduledTask> scheduled) {
        return scheduled.stream().map(ScheduledTask::title).toList();
    }

    @Test
    @DisplayName("Slots are filled in order with the tasks earlier slots left over")
    void fillsSlotsInOrder() {
        List<Task> tasks = List.of(
                task("C", Priority.LOW, 30),
                task("B", Priority.MEDIUM, 40),
                task("A", Priority.HIGH, 50));
        List<SlotConfig> slots = List.of(new SlotConfig("Morning", 60), new SlotConfig("Afternoon", 60));

        SlotPlan plan = planner.plan(tasks, slots, TODAY);

        assertEquals(List.of("Morning", "Afternoon"), List.copyOf(plan.getSlots().keySet()));
        assertEquals(List.of("A"), titles(plan.getSlot("Morning")));
        assertEquals(List.of("B", "C"), titles(plan.getSlot("Afternoon")));
        assertEquals(20, plan.getSlot("Afternoon").get(1).allocatedMinutes());
        assertTrue(plan.getUnscheduled().isEmpty());
        assertEquals(110, plan.totalAllocatedMinutes());
    }

    @Test
    @DisplayName("A partially scheduled task is not offered to later slots")
    void partialTaskClaimed() {
        List<Task> tasks = List.of(task("X", Priority.HIGH, 50), task("Y", Priority.LOW, 20));
        List<SlotConfig> slots = List.of(new SlotConfig("Short", 30), new SlotConfig("Long", 60));

        SlotPlan plan = planner.plan(tasks, slots, TODAY);

        assertEquals(List.of("X"), titles(plan.getSlot("Short")));
        assertTrue(plan.getSlot("Short").get(0).isPartial());
        assertEquals(List.of("Y"), titles(plan.getSlot("Long")));
        assertTrue(plan.getUnscheduled().isEmpty());
    }

    @Test
    @DisplayName("Tasks no slot could take end up unscheduled")
    void leftoverTasks() {
        List<Task> tasks = List.of(task("A", Priority.HIGH, 30), task("B", Priority.HIGH, 300));
        List<SlotConfig> slots = List.of(new SlotConfig("Tiny", 40));

        SlotPlan plan = planner.plan(tasks, slots, TODAY);

        assertEquals(List.of("A"), titles(plan.getSlot("Tiny")));
        assertEquals(List.of("B"), plan.getUnscheduled().stream().map(Task::getTitle).toList());
    }

    @Test
    @DisplayName("A task listed twice keeps its second entry for the next slot")
    void duplicateEntryCarriedOver() {
        Task review = task("Review", Priority.HIGH, 40);
        List<Task> tasks = List.of(review, review);
        List<SlotConfig> slots = List.of(new SlotConfig("Morning", 40), new SlotConfig("Afternoon", 40));

        SlotPlan plan = planner.plan(tasks, slots, TODAY);

        assertEquals(List.of("Review"), titles(plan.getSlot("Morning")));
        assertEquals(List.of("Review"), titles(plan.getSlot("Afternoon")));
        assertTrue(plan.getUnscheduled().isEmpty());
    }

    @Test
    @DisplayName("A task listed twice stays pending once when only one copy fits")
    void duplicateEntryLeftOver() {
        Task review = task("Review", Priority.HIGH, 40);

        SlotPlan plan = planner.plan(List.of(review, review), List.of(new SlotConfig("Morning", 40)), TODAY);

        assertEquals(List.of("Review"), titles(plan.getSlot("Morning")));
        assertEquals(1, plan.getUnscheduled().size());
        assertSame(review, plan.getUnscheduled().get(0));
    }

    @Test
    @DisplayName("No tasks gives every slot an empty schedule")
    void noTasks() {
        SlotPlan plan = planner.plan(List.of(), SlotConfig.defaults(), TODAY);

        assertEquals(3, plan.getSlots().size());
        plan.getSlots().values().forEach(s -> assertTrue(s.isEmpty()));
        assertTrue(plan.getUnscheduled().isEmpty());
    }

    @Test
    @DisplayName("Reserved, blank and duplicate slot names are skipped")
    void invalidSlotsSkipped() {
        List<SlotConfig> slots = List.of(
                new SlotConfig("Morning", 30),
                new SlotConfig(SlotPlan.UNSCHEDULED, 60),
                new SlotConfig(" ", 60),
                new SlotConfig("Morning", 60));

        SlotPlan plan = planner.plan(List.of(task("A", Priority.HIGH, 30)), slots, TODAY);

        assertEquals(List.of("Morning"), List.copyOf(plan.getSlots().keySet()));
    }

    @Test
    @DisplayName("asMap lists every slot followed by the Unscheduled bucket")
    void asMapHasUnscheduledBucket() {
        List<Task> tasks = List.of(
                task("A", Priority.HIGH, 120),
                task("B", Priority.HIGH, 120),
                task("C", Priority.HIGH, 120),
                task("D", Priority.HIGH, 120));
        SlotPlan plan = planner.plan(tasks, SlotConfig.defaults(), TODAY);

        List<String> keys = List.copyOf(plan.asMap().keySet());
        assertEquals(List.of("Morning Focus", "Afternoon Work", "Evening Tasks", SlotPlan.UNSCHEDULED), keys);
        assertEquals(List.of("D"), plan.getUnscheduled().stream().map(Task::getTitle).toList());
        assertEquals(1, plan.asMap().get(SlotPlan.UNSCHEDULED).size());
    }
}
