package flowescrow.escrow.model;

/**
 * Platform fee rate and the account that receives fee transfers.
 *
 * @param feeBps       fee in basis points, between 0 and {@link #MAX_FEE_BPS}
 * @param feeRecipient account credited with the fee on every subtask release
 */
public record FeePolicy(int feeBps, String feeRecipient) {

    /** 10000 bps = 100% */
    public static final int BPS_DENOMINATOR = 10_000;

    /** Hard ceiling: 20% */
    public static final int MAX_FEE_BPS = 2_000;

    public FeePolicy {
        if (feeBps < 0 || feeBps > MAX_FEE_BPS) {
            throw new IllegalArgumentException("feeBps must be within [0, " + MAX_FEE_BPS + "]: " + feeBps);
        }
        if (feeRecipient == null || feeRecipient.isBlank()) {
            throw new IllegalArgumentException("feeRecipient is required");
        }
    }

    /**
     * Split a gross amount with floor rounding on the fee.
     * The high and low parts are scaled separately so no intermediate product overflows.
     */
    public FeeSplit split(long gross) {
        if (gross < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + gross);
        }
        long fee = (gross / BPS_DENOMINATOR) * feeBps
                + (gross % BPS_DENOMINATOR) * feeBps / BPS_DENOMINATOR;
        return new FeeSplit(gross, fee, gross - fee);
    }

    public FeePolicy withFeeBps(int newBps) {
        return new FeePolicy(newBps, feeRecipient);
    }

    public FeePolicy withFeeRecipient(String recipient) {
        return new FeePolicy(feeBps, recipient);
    }
}
