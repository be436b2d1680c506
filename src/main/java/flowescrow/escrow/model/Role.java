package flowescrow.escrow.model;

/**
 * Stored roles. Client-of-task is a structural check and is not listed here.
 */
public enum Role {
    /** Manages membership of every role, including itself */
    DEFAULT_ADMIN,
    /** Platform admin: approves on any task, resolves disputes, edits the fee policy */
    ADMIN;

    /** Role whose holders may grant and revoke this one */
    public Role adminRole() {
        return DEFAULT_ADMIN;
    }
}
