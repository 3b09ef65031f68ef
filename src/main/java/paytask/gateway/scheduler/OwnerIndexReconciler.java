package paytask.gateway.scheduler;

import paytask.gateway.model.OwnerIndexEntry;
import paytask.gateway.model.Task;
import paytask.gateway.repository.OwnerIndexRepository;
import paytask.gateway.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Background task that repairs divergence between the task store and the
 * owner index.
 * 
 * The two are written one after the other without a shared transaction, so a
 * failure in between leaves them out of step. The reconciler:
 * 1. Removes index entries whose task is gone or belongs to someone else
 * 2. Appends tasks missing from their owner's list
 */
public class OwnerIndexReconciler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(OwnerIndexReconciler.class);

    private final TaskRepository taskRepository;
    private final OwnerIndexRepository ownerIndex;

    public OwnerIndexReconciler(TaskRepository taskRepository, OwnerIndexRepository ownerIndex) {
        this.taskRepository = taskRepository;
        this.ownerIndex = ownerIndex;
    }

    @Override
    public void run() {
        try {
            reconcile();
        } catch (Exception e) {
            log.error("Index reconciler error", e);
        }
    }

    /**
     * Runs concurrently with claims and deletes. The index is read before the
     * store, and every repair is re-checked against the live rows first, so a
     * write landing between the two reads is never undone.
     *
     * @return number of repaired entries
     */
    public int reconcile() {
        List<OwnerIndexEntry> entries = ownerIndex.findAllEntries();
        Map<String, Task> tasks = taskRepository.findAll().stream()
                .collect(Collectors.toMap(Task::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        int dropped = 0;
        int added = 0;
        Set<String> indexedIds = new HashSet<>();

        for (OwnerIndexEntry entry : entries) {
            Task task = tasks.get(entry.taskId());
            if (task != null && task.isOwnedBy(entry.owner())) {
                indexedIds.add(entry.taskId());
                continue;
            }
            if (isOwnedInStore(entry.owner(), entry.taskId())) {
                indexedIds.add(entry.taskId());
                continue;
            }
            if (ownerIndex.remove(entry.owner(), entry.taskId())) {
                dropped++;
                log.warn("Dropped dangling index entry {} -> {}", entry.owner(), entry.taskId());
            }
        }

        for (Task task : tasks.values()) {
            if (indexedIds.contains(task.id()) || ownerIndex.contains(task.owner(), task.id())) {
                continue;
            }
            // Deleted since the snapshot: the delete already removed its entry
            if (!isOwnedInStore(task.owner(), task.id())) {
                continue;
            }
            ownerIndex.append(task.owner(), task.id());
            added++;
            log.warn("Re-indexed task {} for owner {}", task.id(), task.owner());
        }

        if (dropped + added > 0) {
            log.info("Index reconciler: {} dropped, {} re-indexed", dropped, added);
        } else {
            log.debug("Owner index consistent");
        }

        return dropped + added;
    }

    private boolean isOwnedInStore(String owner, String taskId) {
        return taskRepository.findById(taskId)
                .map(task -> task.isOwnedBy(owner))
                .orElse(false);
    }
}
