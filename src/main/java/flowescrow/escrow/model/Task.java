package flowescrow.escrow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable ledger record of one escrowed task.
 * The repository is the only writer; services read it and derive updates.
 */
public final class Task {
    private final long id;
    private final String client;
    private final long totalAmount;
    private final long releasedAmount;
    private final TaskStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Task(Builder builder) {
        if (builder.id <= 0) {
            throw new IllegalArgumentException("id must be positive");
        }
        this.id = builder.id;
        this.client = Objects.requireNonNull(builder.client, "client is required");
        this.totalAmount = builder.totalAmount;
        this.releasedAmount = builder.releasedAmount;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        if (releasedAmount < 0 || releasedAmount > totalAmount) {
            throw new IllegalArgumentException(
                    "releasedAmount " + releasedAmount + " outside [0, " + totalAmount + "]");
        }
    }

    // Getters
    public long id() {
        return id;
    }

    public String client() {
        return client;
    }

    public long totalAmount() {
        return totalAmount;
    }

    public long releasedAmount() {
        return releasedAmount;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Budget not yet paid out */
    public long remainingAmount() {
        return totalAmount - releasedAmount;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isClient(String caller) {
        return client.equals(caller);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .client(client)
                .totalAmount(totalAmount)
                .releasedAmount(releasedAmount)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String client;
        private long totalAmount;
        private long releasedAmount = 0;
        private TaskStatus status = TaskStatus.FUNDED;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder client(String client) {
            this.client = client;
            return this;
        }

        public Builder totalAmount(long totalAmount) {
            this.totalAmount = totalAmount;
            return this;
        }

        public Builder releasedAmount(long releasedAmount) {
            this.releasedAmount = releasedAmount;
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

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
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
        return id == task.id
                && totalAmount == task.totalAmount
                && releasedAmount == task.releasedAmount
                && client.equals(task.client)
                && status == task.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, client, totalAmount, releasedAmount, status);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", client='" + client + "', total=" + totalAmount
                + ", released=" + releasedAmount + ", status=" + status + '}';
    }
}
