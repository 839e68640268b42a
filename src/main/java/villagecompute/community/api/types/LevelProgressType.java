package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.community.data.models.LevelTier;

/**
 * Progress of a points balance toward the next level tier.
 *
 * <p>
 * At the top tier {@code nextLevel} is null, {@code pointsToNext} is 0 and {@code progressPercent} is 100.
 */
public record LevelProgressType(@JsonProperty("points") int points,

        @JsonProperty("level") LevelTier level,

        @JsonProperty("level_name") String levelName,

        @JsonProperty("next_level") LevelTier nextLevel,

        @JsonProperty("points_to_next") int pointsToNext,

        @JsonProperty("progress_percent") int progressPercent,

        @JsonProperty("is_max_level") boolean isMaxLevel) {

    /**
     * Computes progress for a balance.
     *
     * @param points
     *            current balance (negative treated as 0)
     * @return progress snapshot
     */
    public static LevelProgressType forPoints(int points) {
        int balance = Math.max(0, points);
        LevelTier level = LevelTier.forPoints(balance);
        return level.next().map(next -> {
            int span = next.threshold() - level.threshold();
            int progress = (int) Math.round(100.0 * (balance - level.threshold()) / span);
            return new LevelProgressType(balance, level, level.displayName(), next, next.threshold() - balance,
                    progress, false);
        }).orElseGet(() -> new LevelProgressType(balance, level, level.displayName(), null, 0, 100, true));
    }
}
