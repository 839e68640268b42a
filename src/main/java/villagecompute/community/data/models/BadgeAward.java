package villagecompute.community.data.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.UUID;

/**
 * A badge earned by a user. The (badge_id, user_id) constraint makes each badge earnable once.
 *
 * <p>
 * Rows are written with {@code INSERT ... ON CONFLICT DO NOTHING} by {@code BadgeAwardRepository}, so the
 * identifier is assigned by the caller rather than generated.
 */
@Entity
@Table(
        name = "badge_awards",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"badge_id", "user_id"}))
public class BadgeAward {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "badge_id",
            nullable = false)
    public UUID badgeId;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "awarded_by_user_id")
    public UUID awardedByUserId;

    @Column(
            name = "earned_at",
            nullable = false)
    public Instant earnedAt;
}
