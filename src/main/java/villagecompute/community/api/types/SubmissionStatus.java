package villagecompute.community.api.types;

public enum SubmissionStatus {
    /** Persisted and visible. */
    ACCEPTED,
    /** Persisted in cleaned form, pending admin review. */
    FLAGGED,
    /** Rejected by the moderation gate, not persisted. */
    BLOCKED,
    /** Rejected because the author is banned or suspended, not moderated. */
    DENIED
}
