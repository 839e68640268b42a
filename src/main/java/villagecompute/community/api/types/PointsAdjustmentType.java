package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.community.data.models.LevelTier;

import java.util.UUID;

/**
 * Before/after snapshot of a points adjustment.
 */
public record PointsAdjustmentType(@JsonProperty("user_id") UUID userId,

        @JsonProperty("delta") int delta,

        @JsonProperty("old_points") int oldPoints,

        @JsonProperty("new_points") int newPoints,

        @JsonProperty("old_level") LevelTier oldLevel,

        @JsonProperty("new_level") LevelTier newLevel) {

    public boolean leveledUp() {
        return newLevel.ordinal() > oldLevel.ordinal();
    }

    public boolean levelChanged() {
        return newLevel != oldLevel;
    }

    /**
     * Snapshot for an adjustment that changed nothing.
     */
    public static PointsAdjustmentType unchanged(UUID userId, int points, LevelTier level) {
        return new PointsAdjustmentType(userId, 0, points, points, level, level);
    }
}
