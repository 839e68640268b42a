package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.community.data.models.LevelTier;

import java.util.UUID;

/**
 * One leaderboard row. {@code points} is the score for the requested timeframe; {@code totalPoints} is the current
 * balance.
 */
public record LeaderboardEntryType(@JsonProperty("rank") int rank,

        @JsonProperty("user_id") UUID userId,

        @JsonProperty("username") String username,

        @JsonProperty("points") long points,

        @JsonProperty("total_points") int totalPoints,

        @JsonProperty("level") LevelTier level) {
}
