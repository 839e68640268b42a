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
 * Badge definition with a single eligibility criterion.
 *
 * <p>
 * A user qualifies when {@code stat(criteria_type, criteria_timeframe) <criteria_operator> criteria_value}. Awards
 * are stored in {@link BadgeAward}.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code name} (TEXT, UNIQUE)</li>
 * <li>{@code description}, {@code icon} (TEXT)</li>
 * <li>{@code category} (TEXT) - {@link BadgeCategory}</li>
 * <li>{@code rarity} (TEXT) - {@link BadgeRarity}</li>
 * <li>{@code criteria_type} (TEXT) - {@link BadgeCriteriaType}</li>
 * <li>{@code criteria_value} (BIGINT) - Target value</li>
 * <li>{@code criteria_operator} (TEXT) - {@link ComparisonOperator}</li>
 * <li>{@code criteria_timeframe} (TEXT) - {@link CriteriaTimeframe}</li>
 * <li>{@code reward_points} (INT) - Points granted on award</li>
 * <li>{@code is_active} (BOOLEAN)</li>
 * <li>{@code sort_order} (INT)</li>
 * <li>{@code created_at} (TIMESTAMPTZ)</li>
 * </ul>
 */
@Entity
@Table(
        name = "badges")
public class Badge {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            nullable = false,
            unique = true)
    public String name;

    @Column(
            nullable = false)
    public String description;

    @Column
    public String icon;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false)
    public BadgeCategory category = BadgeCategory.ACHIEVEMENT;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false)
    public BadgeRarity rarity = BadgeRarity.COMMON;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "criteria_type",
            nullable = false)
    public BadgeCriteriaType criteriaType;

    @Column(
            name = "criteria_value",
            nullable = false)
    public long criteriaValue;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "criteria_operator",
            nullable = false)
    public ComparisonOperator criteriaOperator = ComparisonOperator.GREATER_OR_EQUAL;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "criteria_timeframe",
            nullable = false)
    public CriteriaTimeframe criteriaTimeframe = CriteriaTimeframe.ALL_TIME;

    @Column(
            name = "reward_points",
            nullable = false)
    public int rewardPoints;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean isActive = true;

    @Column(
            name = "sort_order",
            nullable = false)
    public int sortOrder;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;
}
