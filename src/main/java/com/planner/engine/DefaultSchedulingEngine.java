package com.planner.engine;

import com.planner.allocation.AllocationResult;
import com.planner.allocation.TaskSplitter;
import com.planner.allocation.TimeAllocator;
import com.planner.analysis.CompletionAnalyzer;
import com.planner.analysis.CompletionEstimate;
import com.planner.analysis.CompletionStats;
import com.planner.analysis.RecommendationGenerator;
import com.planner.analysis.ScheduleAnalyzer;
import com.planner.analysis.ScheduleDiagnostics;
import com.planner.config.PlannerConfig;
import com.planner.config.SlotConfig;
import com.planner.core.ScheduledTask;
import com.planner.core.Task;
import com.planner.priority.DefaultPriorityScorer;
import com.planner.priority.PriorityScorer;
import com.planner.priority.TaskSorter;
import com.planner.session.SessionPlan;
import com.planner.session.SessionPlanner;
import com.planner.slot.MultiSlotPlanner;
import com.planner.slot.SlotPlan;
import com.planner.suggestion.BreakSuggestionProvider;
import com.planner.suggestion.RotatingBreakSuggestionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link SchedulingEngine} wiring the scorer, sorter, allocator,
 * splitter, planners and analyzers from one {@link PlannerConfig}.
 * Stateless apart from its configuration, so a single instance may serve
 * concurrent calls.
 */
public class DefaultSchedulingEngine implements SchedulingEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultSchedulingEngine.class);

    private final PlannerConfig config;
    private final Clock clock;
    private final TaskSorter sorter;
    private final TimeAllocator allocator;
    private final TaskSplitter splitter;
    private final MultiSlotPlanner slotPlanner;
    private final SessionPlanner sessionPlanner;
    private final ScheduleAnalyzer analyzer;
    private final RecommendationGenerator recommendations;
    private final CompletionAnalyzer completion;

    public DefaultSchedulingEngine(PlannerConfig config) {
        this(config, Clock.systemDefaultZone(), new RotatingBreakSuggestionProvider());
    }

    public DefaultSchedulingEngine(PlannerConfig config, Clock clock, BreakSuggestionProvider suggestions) {
        this(config, clock, suggestions, new DefaultPriorityScorer(config.scoring()));
    }

    public DefaultSchedulingEngine(PlannerConfig config, Clock clock,
                                   BreakSuggestionProvider suggestions, PriorityScorer scorer) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.sorter = new TaskSorter(scorer);
        this.allocator = new TimeAllocator(config.allocation(), suggestions);
        this.splitter = new TaskSplitter(config.split());
        this.slotPlanner = new MultiSlotPlanner(sorter, allocator);
        this.sessionPlanner = new SessionPlanner(sorter, config.sessions());
        this.analyzer = new ScheduleAnalyzer();
        this.recommendations = new RecommendationGenerator(config.recommendations());
        this.completion = new CompletionAnalyzer(config.estimation());
        log.info("SchedulingEngine '{}' initialized (minimum chunk {} min, {} default slots)",
                config.name(), config.allocation().minimumChunkMinutes(), config.slots().size());
    }

    @Override
    public AllocationResult generateSchedule(List<Task> tasks, int availableMinutes) {
        return allocator.allocate(sorter.sort(activeTasks(tasks), today()), availableMinutes);
    }

    @Override
    public SlotPlan planSlots(List<Task> tasks) {
        return planSlots(tasks, config.slots());
    }

    @Override
    public SlotPlan planSlots(List<Task> tasks, List<SlotConfig> slots) {
        List<SlotConfig> effective = slots == null || slots.isEmpty() ? config.slots() : slots;
        return slotPlanner.plan(activeTasks(tasks), effective, today());
    }

    @Override
    public SessionPlan planSessions(List<Task> tasks) {
        return sessionPlanner.plan(activeTasks(tasks), today());
    }

    @Override
    public SessionPlan planSessions(List<Task> tasks, int sessionLength, int breakLength) {
        return sessionPlanner.plan(activeTasks(tasks), sessionLength, breakLength, today());
    }

    @Override
    public List<Task> splitTask(Task task) {
        return splitTask(task, config.split().maxSessionMinutes());
    }

    @Override
    public List<Task> splitTask(Task task, int maxSessionMinutes) {
        if (task == null) {
            return List.of();
        }
        if (maxSessionMinutes <= 0) {
            log.warn("Not splitting '{}': max session minutes must be positive, got {}",
                    task.getTitle(), maxSessionMinutes);
            return List.of(task);
        }
        return splitter.split(task, maxSessionMinutes);
    }

    @Override
    public ScheduleDiagnostics analyze(AllocationResult result) {
        if (result == null) {
            return ScheduleDiagnostics.empty(0);
        }
        return analyzer.analyze(result.scheduled(), result.budgetMinutes());
    }

    @Override
    public ScheduleDiagnostics analyze(List<ScheduledTask> schedule, int budgetMinutes) {
        return analyzer.analyze(schedule, budgetMinutes);
    }

    @Override
    public List<String> recommend(List<Task> tasks) {
        return recommendations.generate(presentTasks(tasks), today());
    }

    @Override
    public CompletionStats completionStats(List<Task> tasks) {
        return completion.stats(presentTasks(tasks));
    }

    @Override
    public CompletionEstimate estimateCompletion(List<Task> tasks) {
        return completion.estimate(presentTasks(tasks), today());
    }

    @Override
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    private static List<Task> presentTasks(List<Task> tasks) {
        if (tasks == null) {
            return List.of();
        }
        return tasks.stream().filter(Objects::nonNull).toList();
    }

    private static List<Task> activeTasks(List<Task> tasks) {
        return presentTasks(tasks).stream()
                .filter(t -> !t.isCompleted())
                .toList();
    }
}
