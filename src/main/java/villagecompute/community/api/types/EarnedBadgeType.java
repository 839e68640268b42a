package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.community.data.models.Badge;

import java.time.Instant;
import java.util.UUID;

/**
 * Badge newly awarded to a user.
 */
public record EarnedBadgeType(@JsonProperty("badge_id") UUID badgeId,

        @JsonProperty("name") String name,

        @JsonProperty("description") String description,

        @JsonProperty("icon") String icon,

        @JsonProperty("reward_points") int rewardPoints,

        @JsonProperty("earned_at") Instant earnedAt) {

    public static EarnedBadgeType from(Badge badge, Instant earnedAt) {
        return new EarnedBadgeType(badge.id, badge.name, badge.description, badge.icon, badge.rewardPoints, earnedAt);
    }
}
