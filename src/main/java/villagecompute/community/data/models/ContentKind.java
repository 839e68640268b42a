package villagecompute.community.data.models;

/**
 * Kinds of user-generated content that pass through the moderation gate.
 */
public enum ContentKind {
    POST, COMMENT, MESSAGE, FEEDBACK
}
