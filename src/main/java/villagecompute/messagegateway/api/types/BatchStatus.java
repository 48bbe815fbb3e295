package villagecompute.messagegateway.api.types;

/**
 * Aggregate outcome of a batch run.
 */
public enum BatchStatus {
    /** Every item succeeded. */
    COMPLETED,

    /** No item succeeded, or the run stopped early on a failure. */
    FAILED,

    /** Some items succeeded and some failed. */
    PARTIAL
}
