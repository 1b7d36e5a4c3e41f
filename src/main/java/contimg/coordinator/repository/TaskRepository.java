package contimg.coordinator.repository;

import contimg.coordinator.model.Task;
import contimg.coordinator.store.StoreTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of tasks under the {@code tasks/} namespace.
 * Writes are version-checked against {@link Task#version()}.
 */
public interface TaskRepository {

    /**
     * Find a live task by ID inside a transaction, locking it.
     */
    Optional<Task> find(StoreTransaction tx, String taskId);

    /**
     * Find a task by ID, looking in the archive when it is no longer live.
     */
    Optional<Task> findById(String taskId);

    /**
     * All live (non-archived) tasks, ordered by key. Not locked.
     */
    List<Task> findAll(StoreTransaction tx);

    List<Task> findAll();

    /**
     * Save a new task.
     *
     * @return the task with its stored version
     */
    Task insert(StoreTransaction tx, Task task);

    /**
     * Save an updated task.
     *
     * @return the task with its new version
     * @throws contimg.coordinator.store.VersionConflictException if it changed since it was read
     */
    Task update(StoreTransaction tx, Task task);

    /**
     * Move a terminal task into the archive namespace.
     */
    void archive(StoreTransaction tx, Task task);
}
