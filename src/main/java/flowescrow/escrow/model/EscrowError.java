package flowescrow.escrow.model;

/**
 * Reasons an escrow operation is rejected.
 */
public enum EscrowError {
    INVALID_AMOUNT,
    TASK_NOT_FOUND,
    INVALID_STATUS,
    UNAUTHORIZED,
    EXCEEDS_BUDGET,
    ALREADY_PAID,
    TRANSFER_FAILED,
    FEE_TOO_HIGH,
    INVALID_ADDRESS,
    WORK_ALREADY_STARTED,
    /** A mutating call was made while another one is still on the same call stack */
    REENTRANT_CALL
}
