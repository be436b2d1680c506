package flowescrow.escrow.model;

/**
 * Gross release split into the platform fee and the worker share.
 * {@code fee + workerAmount == gross} always.
 */
public record FeeSplit(long gross, long fee, long workerAmount) {
}
