package com.planner.config;

import com.planner.exception.ConfigurationException;
import com.planner.slot.SlotPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads planner configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded and validated configuration
     */
    public static PlannerConfig load(String path) {
        log.info("Loading planner configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static PlannerConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root;
        try {
            root = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Configuration file is not valid YAML: " + e.getMessage(), e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The planner section may sit at the root or under a 'planner' key
        Map<String, Object> plannerConfig = root.containsKey("planner")
                ? (Map<String, Object>) root.get("planner")
                : root;

        String name = getString(plannerConfig, "name", "default-planner");
        String version = getString(plannerConfig, "version", "1.0");

        ScoringConfig scoring = parseScoring((Map<String, Object>) plannerConfig.get("scoring"));
        AllocationConfig allocation = parseAllocation((Map<String, Object>) plannerConfig.get("allocation"));
        SplitConfig split = parseSplit((Map<String, Object>) plannerConfig.get("split"));
        SessionConfig sessions = parseSessions((Map<String, Object>) plannerConfig.get("sessions"));
        List<SlotConfig> slots = parseSlots((List<Map<String, Object>>) plannerConfig.get("slots"));
        RecommendationConfig recommendations = parseRecommendations(
                (Map<String, Object>) plannerConfig.get("recommendations"));
        EstimationConfig estimation = parseEstimation((Map<String, Object>) plannerConfig.get("estimation"));

        PlannerConfig config = new PlannerConfig(
                name, version, scoring, allocation, split, sessions, slots, recommendations, estimation);
        validate(config);

        log.info("Loaded planner configuration: {} v{} with {} slots, minimum chunk {} min, session {}/{} min",
                name, version, slots.size(), allocation.minimumChunkMinutes(),
                sessions.sessionLength(), sessions.breakLength());

        return config;
    }

    @SuppressWarnings("unchecked")
    private static ScoringConfig parseScoring(Map<String, Object> map) {
        ScoringConfig d = ScoringConfig.defaults();
        if (map == null) {
            return d;
        }
        Map<String, Object> tiers = (Map<String, Object>) map.getOrDefault("tier-weights", Map.of());
        Map<String, Object> urgency = (Map<String, Object>) map.getOrDefault("urgency", Map.of());
        return new ScoringConfig(
                getDouble(tiers, "high", d.highWeight()),
                getDouble(tiers, "medium", d.mediumWeight()),
                getDouble(tiers, "low", d.lowWeight()),
                getDouble(urgency, "overdue", d.overdueBoost()),
                getDouble(urgency, "due-today", d.dueTodayBoost()),
                getDouble(urgency, "due-within-3-days", d.dueSoonBoost()),
                getDouble(urgency, "due-within-7-days", d.dueThisWeekBoost()),
                getDouble(map, "duration-penalty-per-minute", d.durationPenaltyPerMinute()),
                getDouble(map, "max-duration-penalty", d.maxDurationPenalty())
        );
    }

    private static AllocationConfig parseAllocation(Map<String, Object> map) {
        if (map == null) {
            return AllocationConfig.defaults();
        }
        return new AllocationConfig(
                getInt(map, "minimum-chunk-minutes", AllocationConfig.defaults().minimumChunkMinutes()));
    }

    private static SplitConfig parseSplit(Map<String, Object> map) {
        SplitConfig d = SplitConfig.defaults();
        if (map == null) {
            return d;
        }
        return new SplitConfig(
                getInt(map, "max-session-minutes", d.maxSessionMinutes()),
                getBoolean(map, "demote-later-sessions", d.demoteLaterSessions()));
    }

    private static SessionConfig parseSessions(Map<String, Object> map) {
        SessionConfig d = SessionConfig.defaults();
        if (map == null) {
            return d;
        }
        return new SessionConfig(
                getInt(map, "session-length", d.sessionLength()),
                getInt(map, "break-length", d.breakLength()),
                getInt(map, "long-break-every", d.longBreakEvery()),
                getInt(map, "long-break-multiplier", d.longBreakMultiplier()));
    }

    private static List<SlotConfig> parseSlots(List<Map<String, Object>> list) {
        if (list == null || list.isEmpty()) {
            log.debug("No slots configured, using default morning/afternoon/evening slots");
            return SlotConfig.defaults();
        }
        List<SlotConfig> slots = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> slotMap = list.get(i);
            String name = getString(slotMap, "name", "slot-" + i);
            int minutes = getInt(slotMap, "minutes", 60);
            slots.add(new SlotConfig(name, minutes));
            log.debug("Parsed slot: name={}, minutes={}", name, minutes);
        }
        return List.copyOf(slots);
    }

    private static RecommendationConfig parseRecommendations(Map<String, Object> map) {
        RecommendationConfig d = RecommendationConfig.defaults();
        if (map == null) {
            return d;
        }
        return new RecommendationConfig(
                getInt(map, "max-recommendations", d.maxRecommendations()),
                getInt(map, "max-active-tasks", d.maxActiveTasks()),
                getInt(map, "min-active-tasks", d.minActiveTasks()),
                getInt(map, "max-high-priority-tasks", d.maxHighPriorityTasks()),
                getInt(map, "daily-minutes-limit", d.dailyMinutesLimit()),
                getDouble(map, "low-completion-rate", d.lowCompletionRate()),
                getDouble(map, "high-completion-rate", d.highCompletionRate()),
                getInt(map, "long-task-minutes", d.longTaskMinutes()),
                getInt(map, "due-soon-days", d.dueSoonDays()));
    }

    private static EstimationConfig parseEstimation(Map<String, Object> map) {
        EstimationConfig d = EstimationConfig.defaults();
        if (map == null) {
            return d;
        }
        return new EstimationConfig(
                getInt(map, "daily-capacity-minutes", d.dailyCapacityMinutes()),
                getDouble(map, "efficiency-factor", d.efficiencyFactor()));
    }

    /**
     * Check the invariants the scheduling algorithms rely on.
     *
     * @throws ConfigurationException on the first violated rule
     */
    public static void validate(PlannerConfig config) {
        ScoringConfig s = config.scoring();
        if (!(s.highWeight() > s.mediumWeight() && s.mediumWeight() > s.lowWeight())) {
            throw new ConfigurationException("Tier weights must be strictly ordered high > medium > low");
        }
        if (!(s.overdueBoost() > s.dueTodayBoost() && s.dueTodayBoost() > s.dueSoonBoost()
                && s.dueSoonBoost() > s.dueThisWeekBoost() && s.dueThisWeekBoost() > 0)) {
            throw new ConfigurationException(
                    "Urgency boosts must be strictly ordered overdue > due-today > due-within-3-days > due-within-7-days > 0");
        }
        if (s.durationPenaltyPerMinute() < 0 || s.maxDurationPenalty() < 0) {
            throw new ConfigurationException("Duration penalty cannot be negative");
        }
        if (s.maxDurationPenalty() >= s.minUrgencyGap() || s.maxDurationPenalty() >= s.minTierGap()) {
            throw new ConfigurationException("max-duration-penalty (" + s.maxDurationPenalty()
                    + ") must be smaller than the smallest urgency gap (" + s.minUrgencyGap()
                    + ") and tier gap (" + s.minTierGap() + ")");
        }
        if (s.minTierGap() <= s.overdueBoost() + s.maxDurationPenalty()) {
            throw new ConfigurationException("Smallest tier gap (" + s.minTierGap()
                    + ") must exceed the overdue boost plus max duration penalty ("
                    + (s.overdueBoost() + s.maxDurationPenalty()) + ") so priority tiers dominate urgency");
        }

        requirePositive(config.allocation().minimumChunkMinutes(), "allocation.minimum-chunk-minutes");
        requirePositive(config.split().maxSessionMinutes(), "split.max-session-minutes");
        requirePositive(config.sessions().sessionLength(), "sessions.session-length");
        requirePositive(config.sessions().breakLength(), "sessions.break-length");
        requirePositive(config.sessions().longBreakEvery(), "sessions.long-break-every");
        requirePositive(config.sessions().longBreakMultiplier(), "sessions.long-break-multiplier");
        requirePositive(config.estimation().dailyCapacityMinutes(), "estimation.daily-capacity-minutes");
        if (config.estimation().efficiencyFactor() <= 0 || config.estimation().efficiencyFactor() > 1) {
            throw new ConfigurationException("estimation.efficiency-factor must be in (0, 1]");
        }
        requirePositive(config.recommendations().maxRecommendations(), "recommendations.max-recommendations");

        Set<String> names = new HashSet<>();
        for (SlotConfig slot : config.slots()) {
            if (slot.name() == null || slot.name().isBlank()) {
                throw new ConfigurationException("Slot name cannot be blank");
            }
            if (SlotPlan.UNSCHEDULED.equals(slot.name())) {
                throw new ConfigurationException("Slot name '" + SlotPlan.UNSCHEDULED + "' is reserved");
            }
            if (!names.add(slot.name())) {
                throw new ConfigurationException("Duplicate slot name '" + slot.name() + "'");
            }
            if (slot.minutes() < 0) {
                throw new ConfigurationException("Slot '" + slot.name() + "' has negative minutes");
            }
        }
    }

    private static void requirePositive(int value, String key) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive, got " + value);
        }
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected an integer for '" + key + "', got: " + value, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected a number for '" + key + "', got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
