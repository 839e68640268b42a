package villagecompute.community.data.models;

public enum RewardClaimStatus {
    PENDING, FULFILLED, CANCELLED
}
