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

/**
 * Reward redeemable with points.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code points_cost} (INT) - Points deducted per claim</li>
 * <li>{@code stock} (INT) - Total claimable units, {@link #UNLIMITED_STOCK} for no limit</li>
 * <li>{@code times_claimed} (INT) - Units claimed so far</li>
 * <li>{@code max_per_user} (INT) - Per-user claim limit, null for no limit</li>
 * <li>{@code level_required} (TEXT) - Minimum {@link LevelTier}, null for none</li>
 * <li>{@code starts_at}, {@code ends_at} (TIMESTAMPTZ) - Availability window, each optional</li>
 * </ul>
 */
@Entity
@Table(
        name = "rewards")
public class Reward {

    public static final int UNLIMITED_STOCK = -1;

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            nullable = false)
    public String name;

    @Column
    public String description;

    @Column(
            name = "points_cost",
            nullable = false)
    public int pointsCost;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean isActive = true;

    @Column(
            nullable = false)
    public int stock = UNLIMITED_STOCK;

    @Column(
            name = "times_claimed",
            nullable = false)
    public int timesClaimed;

    @Column(
            name = "max_per_user")
    public Integer maxPerUser;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "level_required")
    public LevelTier levelRequired;

    @Column(
            name = "starts_at")
    public Instant startsAt;

    @Column(
            name = "ends_at")
    public Instant endsAt;

    public boolean isOutOfStock() {
        return stock != UNLIMITED_STOCK && timesClaimed >= stock;
    }
}
