package paytask.gateway.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable task created by a paid claim.
 * The owner never changes after creation; updates go through {@link #toBuilder()}.
 */
public final class Task {
    private final String id;
    private final String name;
    private final String description;
    private final TaskStatus status;
    private final Instant createdAt;
    private final Instant dueDate; // null when no due date
    private final String owner;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.description = builder.description != null ? builder.description : "";
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.dueDate = builder.dueDate;
        this.owner = Objects.requireNonNull(builder.owner, "owner is required");
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Optional<Instant> dueDate() {
        return Optional.ofNullable(dueDate);
    }

    public String owner() {
        return owner;
    }

    public boolean isOwnedBy(String identity) {
        return owner.equals(identity);
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    /**
     * Apply a patch. Fields absent from the patch keep their value.
     */
    public Task apply(TaskPatch patch) {
        Builder b = toBuilder();
        patch.name().ifPresent(b::name);
        patch.description().ifPresent(b::description);
        switch (patch.dueDateChange()) {
            case UNCHANGED -> {
            }
            case CLEAR -> b.dueDate(null);
            case SET -> b.dueDate(patch.newDueDate());
        }
        return b.build();
    }

    /** Task marked COMPLETED; already completed tasks are returned as-is. */
    public Task complete() {
        return switch (status) {
            case PENDING -> toBuilder().status(TaskStatus.COMPLETED).build();
            case COMPLETED -> this;
        };
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .status(status)
                .createdAt(createdAt)
                .dueDate(dueDate)
                .owner(owner);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private TaskStatus status = TaskStatus.PENDING;
        private Instant createdAt;
        private Instant dueDate;
        private String owner;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder dueDate(Instant dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id)
                && Objects.equals(name, task.name)
                && Objects.equals(description, task.description)
                && status == task.status
                && Objects.equals(createdAt, task.createdAt)
                && Objects.equals(dueDate, task.dueDate)
                && Objects.equals(owner, task.owner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", owner='" + owner + "'}";
    }
}
