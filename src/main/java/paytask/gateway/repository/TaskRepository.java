package paytask.gateway.repository;

import paytask.gateway.model.Task;
import paytask.gateway.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Primary store of tasks, keyed by id.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Write back a modified task. The owner is never changed.
     *
     * @return true if a row was updated
     */
    boolean update(Task task);

    /**
     * Delete a task.
     *
     * @return true if deleted, false if not found
     */
    boolean delete(String taskId);

    /**
     * All stored tasks, oldest first. Used by index reconciliation.
     */
    List<Task> findAll();

    int count();

    int countByStatus(TaskStatus status);
}
