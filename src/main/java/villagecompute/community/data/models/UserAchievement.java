package villagecompute.community.data.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Achievement shown on a member's profile. Badge titles are copied at award time so later edits to the badge
 * definition do not rewrite history.
 */
@Entity
@Table(
        name = "user_achievements")
public class UserAchievement {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "badge_id")
    public UUID badgeId;

    @Column(
            nullable = false)
    public String title;

    @Column
    public String description;

    @Column
    public String icon;

    @Column(
            name = "earned_at",
            nullable = false)
    public Instant earnedAt;

    public static UserAchievement forBadge(UUID userId, Badge badge, Instant earnedAt) {
        UserAchievement achievement = new UserAchievement();
        achievement.userId = userId;
        achievement.badgeId = badge.id;
        achievement.title = badge.name;
        achievement.description = badge.description;
        achievement.icon = badge.icon;
        achievement.earnedAt = earnedAt;
        return achievement;
    }
}
