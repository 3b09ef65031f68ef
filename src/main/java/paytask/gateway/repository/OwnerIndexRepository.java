package paytask.gateway.repository;

import paytask.gateway.model.OwnerIndexEntry;

import java.util.List;

/**
 * Secondary index from owner identity to the ordered ids of the tasks they own.
 * Kept in step with {@link TaskRepository} by the service layer, not by a
 * shared transaction.
 */
public interface OwnerIndexRepository {

    /**
     * Append a task id to the owner's list. Appending an id already listed is a no-op.
     */
    void append(String owner, String taskId);

    /**
     * Task ids of an owner in insertion order; empty if the owner has none.
     */
    List<String> findTaskIds(String owner);

    boolean contains(String owner, String taskId);

    /**
     * Remove a task id from the owner's list.
     *
     * @return false if the id was not listed
     */
    boolean remove(String owner, String taskId);

    /**
     * Every index entry, in insertion order.
     */
    List<OwnerIndexEntry> findAllEntries();
}
