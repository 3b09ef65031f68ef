package paytask.gateway.service;

import paytask.gateway.config.FeeRegistry;
import paytask.gateway.ledger.LedgerVerifier;
import paytask.gateway.model.NewTask;
import paytask.gateway.model.PaymentOrder;
import paytask.gateway.model.ServiceResult;
import paytask.gateway.model.Task;
import paytask.gateway.model.TaskPatch;
import paytask.gateway.model.TaskStatus;
import paytask.gateway.repository.OwnerIndexRepository;
import paytask.gateway.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Service layer for paid tasks.
 * Orchestrates payment verification, order promotion, task creation and the
 * owner index, and enforces ownership on every mutation.
 *
 * <p>
 * Unauthorized access is reported as NOT_FOUND so that non-owners cannot tell
 * whether a task exists.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final OwnerIndexRepository ownerIndex;
    private final OrderService orderService;
    private final LedgerVerifier ledgerVerifier;
    private final FeeRegistry feeRegistry;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository, OwnerIndexRepository ownerIndex, OrderService orderService,
            LedgerVerifier ledgerVerifier, FeeRegistry feeRegistry, Clock clock) {
        this.taskRepository = taskRepository;
        this.ownerIndex = ownerIndex;
        this.orderService = orderService;
        this.ledgerVerifier = ledgerVerifier;
        this.feeRegistry = feeRegistry;
        this.clock = clock;
    }

    /**
     * Claim a task with proof of payment.
     *
     * <p>
     * The ledger query is the only suspension point. Two claims for the same
     * memo can both pass verification; promotion then lets exactly one through,
     * and the task is only created after promotion succeeded.
     *
     * @param caller    identity of the payer
     * @param newTask   fields of the task to create
     * @param paymentId order id quoted by the caller, used in messages only
     * @param block     ledger block holding the transfer
     * @param memo      memo of the reserved order
     */
    public CompletableFuture<ServiceResult<Task>> claimTask(String caller, NewTask newTask, String paymentId,
            long block, long memo) {
        requireCaller(caller);
        if (newTask == null) {
            throw new IllegalArgumentException("task payload is required");
        }

        OptionalLong fee = feeRegistry.addTaskFee();
        if (fee.isEmpty()) {
            return CompletableFuture.completedFuture(ServiceResult.notConfigured("add task fee not set"));
        }

        return ledgerVerifier.verify(caller, fee.getAsLong(), block, memo)
                .exceptionally(error -> {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    log.warn("Payment verification for memo {} failed: {}", memo, cause.getMessage());
                    return false;
                })
                .thenApply(verified -> {
                    if (!verified) {
                        log.warn("Payment not verified for caller {} memo {} block {}", caller, memo, block);
                        return ServiceResult.<Task>notFound(
                                "cannot complete the payment: cannot verify the payment, memo=" + memo);
                    }
                    return promoteAndCreate(caller, newTask, paymentId, block, memo);
                });
    }

    private ServiceResult<Task> promoteAndCreate(String caller, NewTask newTask, String paymentId, long block,
            long memo) {
        ServiceResult<PaymentOrder> promoted = orderService.claimAndPromote(memo, block);
        if (!promoted.isSuccess()) {
            return ServiceResult.notFound(
                    "cannot complete the payment: there is no pending order with id=" + paymentId);
        }

        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .name(newTask.name())
                .description(newTask.description())
                .status(TaskStatus.PENDING)
                .createdAt(clock.instant())
                .dueDate(newTask.dueDate())
                .owner(caller)
                .build();

        // Store first, then index; the reconciler repairs a failure in between
        taskRepository.save(task);
        ownerIndex.append(caller, task.id());

        log.info("Task {} created for {} (memo={})", task.id(), caller, memo);
        return ServiceResult.ok(task, "task with id " + task.id() + " added");
    }

    /**
     * Mark a task as completed. Completing a completed task succeeds without change.
     */
    public ServiceResult<Task> completeTask(String caller, String taskId) {
        requireCaller(caller);
        ServiceResult<Task> owned = findForMutation(caller, taskId, "modify");
        if (!owned.isSuccess()) {
            return owned;
        }

        Task task = owned.orElseThrow();
        Task completed = task.complete();
        if (completed != task) {
            taskRepository.update(completed);
            log.info("Task {} completed by {}", taskId, caller);
        } else {
            log.debug("Task {} already completed", taskId);
        }
        return ServiceResult.ok(completed, "task with id " + taskId + " completed");
    }

    /**
     * Apply a partial update. An empty patch leaves the task untouched.
     */
    public ServiceResult<Task> updateTask(String caller, String taskId, TaskPatch patch) {
        requireCaller(caller);
        if (patch == null) {
            throw new IllegalArgumentException("patch is required");
        }
        ServiceResult<Task> owned = findForMutation(caller, taskId, "modify");
        if (!owned.isSuccess()) {
            return owned;
        }

        Task task = owned.orElseThrow();
        if (patch.isEmpty()) {
            return ServiceResult.ok(task, "task with id " + taskId + " updated");
        }

        Task updated = task.apply(patch);
        taskRepository.update(updated);
        log.info("Task {} updated by {}", taskId, caller);
        return ServiceResult.ok(updated, "task with id " + taskId + " updated");
    }

    /**
     * Delete a task. The id is removed from the owner index first; if it is not
     * listed there the store is left untouched and NOT_FOUND is returned.
     */
    public ServiceResult<Void> deleteTask(String caller, String taskId) {
        requireCaller(caller);
        ServiceResult<Task> owned = findForMutation(caller, taskId, "delete");
        if (!owned.isSuccess()) {
            return ServiceResult.failure(owned.message());
        }

        if (!ownerIndex.remove(caller, taskId)) {
            log.warn("Task {} exists but is not indexed for owner {}", taskId, caller);
            return ServiceResult.notFound("task not found in user list");
        }

        taskRepository.delete(taskId);
        log.info("Task {} deleted by {}", taskId, caller);
        return ServiceResult.ok(null, "task deleted successfully");
    }

    /**
     * Ids of the tasks an owner holds, in creation order. Never fails.
     */
    public List<String> listByOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            return List.of();
        }
        return ownerIndex.findTaskIds(owner);
    }

    /**
     * A task, if it is listed under the owner.
     */
    public ServiceResult<Task> getIfOwned(String owner, String taskId) {
        if (owner == null || taskId == null || !ownerIndex.contains(owner, taskId)) {
            return ServiceResult.notFound("you do not have access to this task");
        }

        Optional<Task> task = taskRepository.findById(taskId);
        if (task.isEmpty()) {
            log.warn("Task {} indexed for {} but missing from store", taskId, owner);
            return ServiceResult.notFound("task not found");
        }
        return ServiceResult.ok(task.get());
    }

    public int countByStatus(TaskStatus status) {
        return taskRepository.countByStatus(status);
    }

    private ServiceResult<Task> findForMutation(String caller, String taskId, String action) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }

        Optional<Task> task = taskRepository.findById(taskId);
        if (task.isEmpty()) {
            return ServiceResult.notFound("task not found");
        }
        if (!task.get().isOwnedBy(caller)) {
            log.warn("Caller {} tried to {} task {} owned by {}", caller, action, taskId, task.get().owner());
            return ServiceResult.notFound("you are not authorized to " + action + " this task");
        }
        return ServiceResult.ok(task.get());
    }

    private static void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("caller identity is required");
        }
    }
}
