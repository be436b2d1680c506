package flowescrow.escrow.model;

/**
 * Rejected escrow operation. The operation that threw it left no observable change.
 */
public class EscrowException extends RuntimeException {

    private final EscrowError error;

    public EscrowException(EscrowError error, String message) {
        super(error + ": " + message);
        this.error = error;
    }

    public EscrowError error() {
        return error;
    }
}
