package paytask.gateway.model;

/**
 * One row of the owner index: a task id listed under its owner.
 */
public record OwnerIndexEntry(String owner, String taskId) {
}
