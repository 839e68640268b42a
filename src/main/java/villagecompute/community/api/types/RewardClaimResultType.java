package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record RewardClaimResultType(@JsonProperty("claim_id") UUID claimId,

        @JsonProperty("reward_id") UUID rewardId,

        @JsonProperty("reward_name") String rewardName,

        @JsonProperty("points_spent") int pointsSpent,

        @JsonProperty("remaining_points") int remainingPoints) {
}
