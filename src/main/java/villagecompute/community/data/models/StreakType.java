package villagecompute.community.data.models;

/**
 * Activities tracked as daily streaks.
 */
public enum StreakType {
    LOGIN, POST, EVENT, CHALLENGE
}
