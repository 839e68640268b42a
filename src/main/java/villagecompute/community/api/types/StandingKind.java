package villagecompute.community.api.types;

/**
 * Reason a user's standing denies participation.
 */
public enum StandingKind {
    BAN, SUSPENSION
}
