package com.planner.session;

import com.planner.config.ScoringConfig;
import com.planner.config.SessionConfig;
import com.planner.core.Priority;
import com.planner.core.Task;
import com.planner.priority.DefaultPriorityScorer;
import com.planner.priority.TaskSorter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SessionPlanner.
 */
class SessionPlannerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 8, 2);

    private SessionPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new SessionPlanner(
                new TaskSorter(new DefaultPriorityScorer(ScoringConfig.defaults())),
                SessionConfig.defaults());
    }

    private static Task task(String title, Priority priority, int minutes) {
        return Task.builder().title(title).estimatedMinutes(minutes).priority(priority).build();
    }

    @Test
    @DisplayName("Fourth focus session is followed by a long break, the first three by short breaks")
    void breakCadence() {
        List<Task> tasks = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            tasks.add(task("t" + i, Priority.MEDIUM, 25));
        }

        SessionPlan plan = planner.plan(tasks, TODAY);

        List<SessionType> types = plan.sessions().stream().map(Session::type).toList();
        assertEquals(List.of(
                SessionType.FOCUS, SessionType.SHORT_BREAK,
                SessionType.FOCUS, SessionType.SHORT_BREAK,
                SessionType.FOCUS, SessionType.SHORT_BREAK,
                SessionType.FOCUS, SessionType.LONG_BREAK,
                SessionType.FOCUS), types);
        assertEquals(15, plan.sessions().get(7).durationMinutes());
        assertEquals(5, plan.sessions().get(1).durationMinutes());
        assertEquals(125 + 15 + 15, plan.totalMinutes());
    }

    @Test
    @DisplayName("No break after the final focus session")
    void noTrailingBreak() {
        SessionPlan plan = planner.plan(List.of(task("only", Priority.HIGH, 20)), TODAY);

        assertEquals(1, plan.sessions().size());
        assertFalse(plan.sessions().get(0).isBreak());
        assertEquals(20, plan.totalFocusMinutes());
        assertEquals(0, plan.totalBreakMinutes());
    }

    @Test
    @DisplayName("Long task spans several sessions with the remainder last and a breakdown note first")
    void multiSessionTask() {
        SessionPlan plan = planner.plan(List.of(task("Essay", Priority.HIGH, 60)), TODAY);

        List<Session> focus = plan.focusSessions();
        assertEquals(List.of(25, 25, 10), focus.stream().map(Session::durationMinutes).toList());
        assertEquals(List.of(1, 2, 3), focus.stream().map(Session::taskSessionIndex).toList());
        focus.forEach(s -> assertEquals(3, s.taskSessionCount()));
        assertEquals("Consider breaking down 'Essay' - it's longer than a single session",
                focus.get(0).getNote().orElseThrow());
        assertTrue(focus.get(1).getNote().isEmpty());
    }

    @Test
    @DisplayName("Tasks are worked in priority order")
    void priorityOrder() {
        SessionPlan plan = planner.plan(List.of(
                task("low", Priority.LOW, 20),
                task("high", Priority.HIGH, 20)), TODAY);

        List<String> titles = plan.focusSessions().stream()
                .map(s -> s.getTask().orElseThrow().getTitle())
                .toList();
        assertEquals(List.of("high", "low"), titles);
    }

    @Test
    @DisplayName("Positions are consecutive and include breaks")
    void positions() {
        SessionPlan plan = planner.plan(List.of(task("a", Priority.HIGH, 50), task("b", Priority.LOW, 10)), TODAY);

        for (int i = 0; i < plan.sessions().size(); i++) {
            assertEquals(i + 1, plan.sessions().get(i).position());
        }
    }

    @Test
    @DisplayName("Explicit lengths override the configured ones")
    void explicitLengths() {
        SessionPlan plan = planner.plan(List.of(task("a", Priority.HIGH, 100)), 50, 10, TODAY);

        assertEquals(List.of(50, 50), plan.focusSessions().stream().map(Session::durationMinutes).toList());
        assertEquals(List.of(10), plan.breaks().stream().map(Session::durationMinutes).toList());
    }

    @ParameterizedTest
    @CsvSource({
            "0, 5",
            "-25, 5",
            "25, -1"
    })
    @DisplayName("Invalid lengths yield an empty plan")
    void invalidLengths(int sessionLength, int breakLength) {
        assertTrue(planner.plan(List.of(task("a", Priority.HIGH, 30)), sessionLength, breakLength, TODAY).isEmpty());
    }

    @Test
    @DisplayName("Sessions needed is the ceiling of estimate over session length")
    void sessionsNeeded() {
        assertEquals(1, SessionPlanner.sessionsNeeded(25, 25));
        assertEquals(2, SessionPlanner.sessionsNeeded(26, 25));
        assertEquals(4, SessionPlanner.sessionsNeeded(100, 25));
    }
}
