package com.planner.repository;

import com.planner.core.Task;

import java.util.List;
import java.util.Optional;

/**
 * Storage seam for tasks. The scheduling engine never touches a repository;
 * callers read tasks from here and pass them in.
 */
public interface TaskRepository {

    List<Task> findAll();

    List<Task> findActive();

    List<Task> findCompleted();

    Optional<Task> findById(String id);

    /**
     * Store a task, assigning an id when it has none.
     *
     * @return The stored task (with its id)
     */
    Task save(Task task);

    /**
     * @return true if a task was removed
     */
    boolean deleteById(String id);
}
