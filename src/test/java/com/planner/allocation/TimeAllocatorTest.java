package com.planner.allocation;

import com.planner.config.AllocationConfig;
import com.planner.core.Priority;
import com.planner.core.ScheduledTask;
import com.planner.core.Task;
import com.planner.suggestion.BreakSuggestionProvider;
import com.planner.suggestion.RotatingBreakSuggestionProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TimeAllocator.
 */
class TimeAllocatorTest {

    private TimeAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new TimeAllocator(AllocationConfig.defaults(), new RotatingBreakSuggestionProvider());
    }

    private static Task task(String title, int minutes) {
        return Task.builder().title(title).estimatedMinutes(minutes).priority(Priority.MEDIUM).build();
    }

    private static List<String> titles(List<ScheduledTask> scheduled) {
        return scheduled.stream().map(ScheduledTask::title).toList();
    }

    @Test
    @DisplayName("Zero budget schedules nothing and leaves every task unscheduled")
    void zeroBudget() {
        List<Task> tasks = List.of(task("a", 10), task("b", 20));

        AllocationResult result = allocator.allocate(tasks, 0);

        assertTrue(result.isEmpty());
        assertFalse(result.isRejected());
        assertEquals(tasks, result.unscheduled());
        assertEquals(0, result.totalAllocatedMinutes());
    }

    @Test
    @DisplayName("Negative budget is rejected")
    void negativeBudget() {
        AllocationResult result = allocator.allocate(List.of(task("a", 10)), -5);

        assertTrue(result.isRejected());
        assertTrue(result.isEmpty());
        assertTrue(result.getRejectionReason().orElseThrow().contains("-5"));
    }

    @Test
    @DisplayName("Empty task list yields an empty schedule")
    void noTasks() {
        assertTrue(allocator.allocate(List.of(), 120).isEmpty());
        assertTrue(allocator.allocate(null, 120).isEmpty());
    }

    @Test
    @DisplayName("Everything fits: all tasks fully scheduled in order")
    void everythingFits() {
        List<Task> tasks = List.of(task("a", 30), task("b", 45), task("c", 20));

        AllocationResult result = allocator.allocate(tasks, 200);

        assertEquals(List.of("a", "b", "c"), titles(result.scheduled()));
        assertEquals(95, result.totalAllocatedMinutes());
        assertEquals(105, result.remainingBudgetMinutes());
        assertTrue(result.unscheduled().isEmpty());
        result.scheduled().forEach(st -> {
            assertFalse(st.isPartial());
            assertEquals(100.0, st.completionPercentage());
        });
        assertEquals(List.of(1, 2, 3), result.scheduled().stream().map(ScheduledTask::scheduleOrder).toList());
    }

    @Test
    @DisplayName("Remainder below minimum chunk does not start a new task")
    void remainderBelowMinimumChunk() {
        AllocationResult result = allocator.allocate(List.of(task("a", 50), task("b", 30)), 60);

        assertEquals(List.of("a"), titles(result.scheduled()));
        assertEquals(List.of("b"), result.unscheduled().stream().map(Task::getTitle).toList());
        assertEquals(50, result.totalAllocatedMinutes());
    }

    @Test
    @DisplayName("Remainder of at least the minimum chunk gets a partial allocation")
    void partialAllocation() {
        AllocationResult result = allocator.allocate(List.of(task("a", 40), task("b", 30)), 60);

        assertEquals(List.of("a", "b"), titles(result.scheduled()));
        ScheduledTask partial = result.scheduled().get(1);
        assertTrue(partial.isPartial());
        assertEquals(20, partial.allocatedMinutes());
        assertEquals(10, partial.remainingMinutes());
        assertEquals(66.7, partial.completionPercentage());
        assertEquals(60, result.totalAllocatedMinutes());
    }

    @Test
    @DisplayName("A skipped task does not stop shorter later tasks from fitting")
    void skipThenFit() {
        List<Task> tasks = List.of(task("a", 50), task("big", 100), task("small", 10));

        AllocationResult result = allocator.allocate(tasks, 60);

        assertEquals(List.of("a", "small"), titles(result.scheduled()));
        assertEquals(List.of("big"), result.unscheduled().stream().map(Task::getTitle).toList());
    }

    @Test
    @DisplayName("Exactly the minimum chunk left is enough for a partial")
    void exactlyMinimumChunk() {
        AllocationResult result = allocator.allocate(List.of(task("a", 45), task("b", 60)), 60);

        assertEquals(15, result.scheduled().get(1).allocatedMinutes());
        assertEquals(60, result.totalAllocatedMinutes());
        assertEquals(0, result.remainingBudgetMinutes());
    }

    @Test
    @DisplayName("Allocated total never exceeds the budget")
    void neverExceedsBudget() {
        List<Task> tasks = List.of(task("a", 70), task("b", 70), task("c", 70));
        for (int budget = 0; budget <= 250; budget += 7) {
            AllocationResult result = allocator.allocate(tasks, budget);
            assertTrue(result.totalAllocatedMinutes() <= budget, "budget " + budget);
            result.scheduled().forEach(st -> assertTrue(st.allocatedMinutes() > 0));
        }
    }

    @ParameterizedTest
    @CsvSource({
            "10, 5",
            "44, 5",
            "45, 10",
            "89, 10",
            "90, 15",
            "240, 15"
    })
    @DisplayName("Recommended break grows with allocated time")
    void recommendedBreak(int minutes, int expectedBreak) {
        ScheduledTask st = allocator.allocate(List.of(task("a", minutes)), minutes).scheduled().get(0);
        assertEquals(expectedBreak, st.recommendedBreakMinutes());
    }

    @Test
    @DisplayName("Break suggestion comes from the injected provider")
    void breakSuggestionFromProvider() {
        BreakSuggestionProvider fixed = (minutes, position) -> "rest " + minutes + " #" + position;
        TimeAllocator custom = new TimeAllocator(AllocationConfig.defaults(), fixed);

        AllocationResult result = custom.allocate(List.of(task("a", 20), task("b", 60)), 100);

        assertEquals("rest 5 #1", result.scheduled().get(0).breakSuggestion());
        assertEquals("rest 10 #2", result.scheduled().get(1).breakSuggestion());
    }
}
