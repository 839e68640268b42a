package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether a user may claim a reward, with the first failing rule as a user-facing reason.
 */
public record RewardEligibilityType(@JsonProperty("can_claim") boolean canClaim,

        @JsonProperty("reason") String reason) {

    public static RewardEligibilityType eligible() {
        return new RewardEligibilityType(true, null);
    }

    public static RewardEligibilityType ineligible(String reason) {
        return new RewardEligibilityType(false, reason);
    }
}
