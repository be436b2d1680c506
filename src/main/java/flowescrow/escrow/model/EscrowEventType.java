package flowescrow.escrow.model;

/**
 * Kinds of entries in the audit event stream.
 */
public enum EscrowEventType {
    TASK_FUNDED,
    SUBTASK_APPROVED,
    TASK_COMPLETED,
    DISPUTE_RAISED,
    DISPUTE_RESOLVED,
    TASK_CANCELLED,
    FEE_UPDATED,
    FEE_RECIPIENT_UPDATED,
    ROLE_GRANTED,
    ROLE_REVOKED,
    TOKENS_MINTED
}
