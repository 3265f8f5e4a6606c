package com.planner.repository;

import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-memory repository keeping tasks in insertion order.
 */
public class InMemoryTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRepository.class);

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final Object monitor = new Object();

    @Override
    public List<Task> findAll() {
        synchronized (monitor) {
            return List.copyOf(tasks.values());
        }
    }

    @Override
    public List<Task> findActive() {
        return findAll().stream().filter(t -> !t.isCompleted()).toList();
    }

    @Override
    public List<Task> findCompleted() {
        return findAll().stream().filter(Task::isCompleted).toList();
    }

    @Override
    public Optional<Task> findById(String id) {
        synchronized (monitor) {
            return Optional.ofNullable(tasks.get(id));
        }
    }

    @Override
    public Task save(Task task) {
        Task stored;
        synchronized (monitor) {
            stored = task.getId().isPresent() ? task : task.toBuilder().id(nextFreeId()).build();
            tasks.put(stored.getId().orElseThrow(), stored);
        }
        String id = stored.getId().orElseThrow();
        log.debug("Saved task {} '{}'", id, stored.getTitle());
        return stored;
    }

    @Override
    public boolean deleteById(String id) {
        synchronized (monitor) {
            boolean removed = tasks.remove(id) != null;
            if (removed) {
                log.debug("Deleted task {}", id);
            }
            return removed;
        }
    }

    // callers hold the monitor
    private String nextFreeId() {
        String id;
        do {
            id = String.valueOf(nextId.getAndIncrement());
        } while (tasks.containsKey(id));
        return id;
    }

    public int size() {
        synchronized (monitor) {
            return tasks.size();
        }
    }

    /**
     * Ids currently stored, in insertion order.
     */
    public List<String> ids() {
        synchronized (monitor) {
            return new ArrayList<>(tasks.keySet());
        }
    }
}
