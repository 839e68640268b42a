package villagecompute.community.data.models;

/**
 * Sanction kinds recorded in {@link UserWarning}.
 */
public enum WarningType {
    /** Informational, never blocks. */
    WARNING,
    /** Blocks while active and not yet expired. */
    SUSPENSION,
    /** Blocks while active, no expiry. */
    BANNED
}
