package villagecompute.community.data.models;

/**
 * What a content report points at. {@link #USER} reports a member's profile rather than a piece of text.
 */
public enum ReportTarget {
    POST, COMMENT, MESSAGE, USER
}
