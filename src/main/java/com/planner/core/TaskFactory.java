package com.planner.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planner.exception.InvalidTaskInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link Task} records from loosely typed input (JSON or plain maps).
 * <p>
 * Malformed values are replaced by defaults instead of failing:
 * duration 30, priority Medium, no deadline, title "Untitled Task".
 * Only a structurally invalid payload raises {@link InvalidTaskInputException}.
 */
public class TaskFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskFactory.class);

    public static final String DEFAULT_TITLE = "Untitled Task";
    public static final int DEFAULT_ESTIMATED_MINUTES = 30;
    public static final Priority DEFAULT_PRIORITY = Priority.MEDIUM;

    public static final String FIELD_ID = "id";
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_ESTIMATED_TIME = "estimated_time";
    public static final String FIELD_PRIORITY = "priority";
    public static final String FIELD_DEADLINE = "deadline";
    public static final String FIELD_COMPLETED = "completed";
    public static final String FIELD_ACTUAL_TIME = "actual_time";

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * Parse a JSON array of task objects. Array elements that are not objects are skipped.
     *
     * @throws InvalidTaskInputException if the payload is not valid JSON or not an array
     */
    public static List<Task> parseTasks(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidTaskInputException("Task payload is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidTaskInputException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
        return fromArray(root);
    }

    /**
     * Convert a JSON array node of task objects.
     *
     * @throws InvalidTaskInputException if the node is not an array
     */
    public static List<Task> fromArray(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new InvalidTaskInputException("Tasks must be a JSON array, got "
                    + (node == null ? "nothing" : node.getNodeType()));
        }
        List<Task> tasks = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            if (!element.isObject()) {
                log.warn("Skipping task entry {}: expected an object, got {}", i, element.getNodeType());
                continue;
            }
            tasks.add(fromMap(objectMapper.convertValue(element, MAP_TYPE)));
        }
        return tasks;
    }

    /**
     * Parse a single JSON task object.
     *
     * @throws InvalidTaskInputException if the payload is not a JSON object
     */
    public static Task parseTask(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new InvalidTaskInputException("Task must be a JSON object");
            }
            return fromMap(objectMapper.convertValue(node, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new InvalidTaskInputException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Build a task from a field map using the wire field names.
     */
    public static Task fromMap(Map<String, ?> fields) {
        if (fields == null) {
            throw new InvalidTaskInputException("Task fields cannot be null");
        }
        String title = parseTitle(fields.get(FIELD_TITLE));
        return Task.builder()
                .id(fields.get(FIELD_ID) != null ? fields.get(FIELD_ID).toString() : null)
                .title(title)
                .estimatedMinutes(parseEstimatedMinutes(title, fields.get(FIELD_ESTIMATED_TIME)))
                .priority(parsePriority(title, fields.get(FIELD_PRIORITY)))
                .deadline(parseDeadline(title, fields.get(FIELD_DEADLINE)).orElse(null))
                .completed(parseBoolean(fields.get(FIELD_COMPLETED)))
                .actualMinutes(parsePositiveInt(fields.get(FIELD_ACTUAL_TIME)).orElse(null))
                .build();
    }

    /**
     * Parse an ISO date (YYYY-MM-DD) or pass a {@link LocalDate} through.
     * Anything else is treated as no deadline.
     */
    public static Optional<LocalDate> parseDate(Object value) {
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.toString().trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String parseTitle(Object value) {
        if (value == null || value.toString().isBlank()) {
            return DEFAULT_TITLE;
        }
        return value.toString().trim();
    }

    private static int parseEstimatedMinutes(String title, Object value) {
        if (value == null) {
            return DEFAULT_ESTIMATED_MINUTES;
        }
        Optional<Integer> minutes = parsePositiveInt(value);
        if (minutes.isEmpty()) {
            log.warn("Task '{}': invalid estimated_time '{}', using {}", title, value, DEFAULT_ESTIMATED_MINUTES);
        }
        return minutes.orElse(DEFAULT_ESTIMATED_MINUTES);
    }

    private static Priority parsePriority(String title, Object value) {
        if (value == null) {
            return DEFAULT_PRIORITY;
        }
        Optional<Priority> priority = Priority.parse(value);
        if (priority.isEmpty()) {
            log.warn("Task '{}': invalid priority '{}', using {}", title, value, DEFAULT_PRIORITY);
        }
        return priority.orElse(DEFAULT_PRIORITY);
    }

    private static Optional<LocalDate> parseDeadline(String title, Object value) {
        Optional<LocalDate> deadline = parseDate(value);
        if (deadline.isEmpty() && value != null && !value.toString().isBlank()) {
            log.warn("Task '{}': unparseable deadline '{}', treating as no deadline", title, value);
        }
        return deadline;
    }

    private static Optional<Integer> parsePositiveInt(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d <= 0 || d > Integer.MAX_VALUE) {
                return Optional.empty();
            }
            return Optional.of((int) d);
        }
        try {
            int parsed = Integer.parseInt(value.toString().trim());
            return parsed > 0 ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean parseBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }
}
