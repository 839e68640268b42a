package villagecompute.community.data.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "reward_claims")
public class RewardClaim {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "reward_id",
            nullable = false)
    public UUID rewardId;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "points_spent",
            nullable = false)
    public int pointsSpent;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false)
    public RewardClaimStatus status = RewardClaimStatus.PENDING;

    @Column(
            name = "shipping_address")
    public String shippingAddress;

    @Column(
            name = "claimed_at",
            nullable = false)
    public Instant claimedAt;
}
