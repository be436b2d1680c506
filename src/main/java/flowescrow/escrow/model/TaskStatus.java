package flowescrow.escrow.model;

/**
 * Escrow task lifecycle status.
 */
public enum TaskStatus {
    /** Budget deposited, nothing released yet */
    FUNDED,
    /** At least one subtask approved and paid */
    IN_PROGRESS,
    /** Closed by the client or an admin, remainder refunded */
    COMPLETED,
    /** Frozen pending arbitration */
    DISPUTED,
    /** Cancelled before any work was paid, full refund */
    CANCELLED,
    /** Arbitration finished, unreleased funds redistributed */
    RESOLVED;

    /** Completed, cancelled and resolved tasks never change again */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == RESOLVED;
    }

    /** Subtasks may be approved and disputes raised only while the task is open */
    public boolean isOpen() {
        return this == FUNDED || this == IN_PROGRESS;
    }
}
