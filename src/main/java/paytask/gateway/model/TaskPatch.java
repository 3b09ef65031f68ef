package paytask.gateway.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Partial update of a task. Every field is optional; the due date has three
 * states so that "clear the due date" differs from "leave it alone".
 */
public final class TaskPatch {

    public enum DueDateChange {
        UNCHANGED,
        CLEAR,
        SET
    }

    private static final TaskPatch EMPTY = new TaskPatch(null, null, DueDateChange.UNCHANGED, null);

    private final String name;
    private final String description;
    private final DueDateChange dueDateChange;
    private final Instant newDueDate;

    private TaskPatch(String name, String description, DueDateChange dueDateChange, Instant newDueDate) {
        this.name = name;
        this.description = description;
        this.dueDateChange = Objects.requireNonNull(dueDateChange);
        if (dueDateChange == DueDateChange.SET && newDueDate == null) {
            throw new IllegalArgumentException("dueDate value required when setting it");
        }
        this.newDueDate = dueDateChange == DueDateChange.SET ? newDueDate : null;
    }

    public static TaskPatch empty() {
        return EMPTY;
    }

    public TaskPatch withName(String name) {
        return new TaskPatch(name, description, dueDateChange, newDueDate);
    }

    public TaskPatch withDescription(String description) {
        return new TaskPatch(name, description, dueDateChange, newDueDate);
    }

    public TaskPatch withDueDate(Instant dueDate) {
        return new TaskPatch(name, description, DueDateChange.SET, dueDate);
    }

    public TaskPatch clearingDueDate() {
        return new TaskPatch(name, description, DueDateChange.CLEAR, null);
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public DueDateChange dueDateChange() {
        return dueDateChange;
    }

    /** The replacement due date; only meaningful for {@link DueDateChange#SET}. */
    public Instant newDueDate() {
        return newDueDate;
    }

    public boolean isEmpty() {
        return name == null && description == null && dueDateChange == DueDateChange.UNCHANGED;
    }
}
