package villagecompute.community.data.models;

import java.util.Optional;

/**
 * Level tiers derived from a user's points balance.
 *
 * <p>
 * <b>Tier Table:</b>
 * <ul>
 * <li>New Member: 0-99</li>
 * <li>Builder: 100-249</li>
 * <li>Overcomer: 250-499</li>
 * <li>Mentor-in-Training: 500-749</li>
 * <li>Legacy Leader: 750+</li>
 * </ul>
 *
 * <p>
 * Declaration order is ascending by threshold; {@link #forPoints(long)} and {@link #next()} rely on it.
 */
public enum LevelTier {

    NEW_MEMBER("New Member", 0),
    BUILDER("Builder", 100),
    OVERCOMER("Overcomer", 250),
    MENTOR_IN_TRAINING("Mentor-in-Training", 500),
    LEGACY_LEADER("Legacy Leader", 750);

    private final String displayName;
    private final int threshold;

    LevelTier(String displayName, int threshold) {
        this.displayName = displayName;
        this.threshold = threshold;
    }

    public String displayName() {
        return displayName;
    }

    public int threshold() {
        return threshold;
    }

    /**
     * Returns the highest tier whose threshold does not exceed {@code points}. Negative input maps to
     * {@link #NEW_MEMBER}.
     */
    public static LevelTier forPoints(long points) {
        LevelTier result = NEW_MEMBER;
        for (LevelTier tier : values()) {
            if (points >= tier.threshold) {
                result = tier;
            }
        }
        return result;
    }

    /**
     * Returns the tier above this one, or empty at the top tier.
     */
    public Optional<LevelTier> next() {
        LevelTier[] tiers = values();
        return ordinal() + 1 < tiers.length ? Optional.of(tiers[ordinal() + 1]) : Optional.empty();
    }

    public boolean isAtLeast(LevelTier other) {
        return ordinal() >= other.ordinal();
    }
}
