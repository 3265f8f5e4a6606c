package com.planner.priority;

import com.planner.config.ScoringConfig;
import com.planner.core.Priority;
import com.planner.core.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskSorter and PriorityKey ordering.
 */
class TaskSorterTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 8, 2);

    private TaskSorter sorter;

    @BeforeEach
    void setUp() {
        sorter = new TaskSorter(new DefaultPriorityScorer(ScoringConfig.defaults()));
    }

    private static Task task(String title, Priority priority, int minutes, LocalDate deadline) {
        return Task.builder().title(title).estimatedMinutes(minutes).priority(priority).deadline(deadline).build();
    }

    private static List<String> titles(List<Task> tasks) {
        return tasks.stream().map(Task::getTitle).toList();
    }

    @Test
    @DisplayName("Null or empty input sorts to an empty list")
    void emptyInput() {
        assertTrue(sorter.sort(null, TODAY).isEmpty());
        assertTrue(sorter.sort(List.of(), TODAY).isEmpty());
    }

    @Test
    @DisplayName("High task due in 30 days ranks ahead of overdue Low task")
    void highBeforeOverdueLow() {
        Task lowOverdue = task("low", Priority.LOW, 15, TODAY.minusDays(3));
        Task highLater = task("high", Priority.HIGH, 120, TODAY.plusDays(30));

        assertEquals(List.of("high", "low"), titles(sorter.sort(List.of(lowOverdue, highLater), TODAY)));
    }

    @Test
    @DisplayName("Within a tier, more urgent tasks come first")
    void urgencyWithinTier() {
        List<Task> tasks = List.of(
                task("none", Priority.MEDIUM, 30, null),
                task("week", Priority.MEDIUM, 30, TODAY.plusDays(6)),
                task("today", Priority.MEDIUM, 30, TODAY),
                task("overdue", Priority.MEDIUM, 30, TODAY.minusDays(1)));

        assertEquals(List.of("overdue", "today", "week", "none"), titles(sorter.sort(tasks, TODAY)));
    }

    @Test
    @DisplayName("Shorter task wins between otherwise equal tasks")
    void shorterFirst() {
        List<Task> tasks = List.of(
                task("long", Priority.HIGH, 80, null),
                task("short", Priority.HIGH, 20, null));

        assertEquals(List.of("short", "long"), titles(sorter.sort(tasks, TODAY)));
    }

    @Test
    @DisplayName("Equal keys keep input order")
    void stableForEqualKeys() {
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            tasks.add(task("t" + i, Priority.MEDIUM, 60, null));
        }
        tasks.add(task("capped-a", Priority.LOW, 100, null));
        tasks.add(task("capped-b", Priority.LOW, 100, null));

        List<String> sorted = titles(sorter.sort(tasks, TODAY));
        assertEquals(List.of("t0", "t1", "t2", "t3", "t4", "t5", "t6", "t7", "t8", "t9", "capped-a", "capped-b"),
                sorted);
    }

    @Test
    @DisplayName("Sorting does not modify the input list")
    void inputUntouched() {
        List<Task> tasks = new ArrayList<>(List.of(
                task("b", Priority.LOW, 10, null),
                task("a", Priority.HIGH, 10, null)));

        List<Task> sorted = sorter.sort(tasks, TODAY);

        assertEquals(List.of("b", "a"), titles(tasks));
        assertEquals(List.of("a", "b"), titles(sorted));
    }

    @Test
    @DisplayName("PriorityKey orders by score, then duration, then input index")
    void priorityKeyOrdering() {
        PriorityKey best = new PriorityKey(100, 30, 5);
        PriorityKey shorter = new PriorityKey(50, 10, 9);
        PriorityKey longer = new PriorityKey(50, 20, 0);
        PriorityKey later = new PriorityKey(50, 20, 1);

        assertTrue(best.compareTo(shorter) < 0);
        assertTrue(shorter.compareTo(longer) < 0);
        assertTrue(longer.compareTo(later) < 0);
        assertEquals(0, later.compareTo(new PriorityKey(50, 20, 1)));
        assertEquals(later, new PriorityKey(50, 20, 1));
    }
}
