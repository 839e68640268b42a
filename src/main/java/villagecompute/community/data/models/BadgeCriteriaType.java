package villagecompute.community.data.models;

/**
 * The user statistic a badge criterion is evaluated against.
 *
 * <p>
 * {@link #CUSTOM} criteria are never satisfied automatically; such badges are awarded by an admin.
 */
public enum BadgeCriteriaType {
    /** Points balance, or points earned within the timeframe. */
    POINTS,
    /** Approved posts authored. */
    POSTS,
    /** Approved comments authored. */
    COMMENTS,
    /** Completed courses. */
    COURSES,
    /** Events attended. */
    EVENTS,
    /** Current daily login streak. */
    STREAK,
    CUSTOM
}
