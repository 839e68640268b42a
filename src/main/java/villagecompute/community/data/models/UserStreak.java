package villagecompute.community.data.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Daily activity streak for one user and one {@link StreakType}.
 */
@Entity
@Table(
        name = "user_streaks",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"user_id", "streak_type"}))
public class UserStreak {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "streak_type",
            nullable = false)
    public StreakType streakType;

    @Column(
            name = "current_count",
            nullable = false)
    public int currentCount;

    @Column(
            name = "longest_count",
            nullable = false)
    public int longestCount;

    @Column(
            name = "last_activity_date")
    public LocalDate lastActivityDate;

    public static UserStreak start(UUID userId, StreakType streakType) {
        UserStreak streak = new UserStreak();
        streak.userId = userId;
        streak.streakType = streakType;
        return streak;
    }
}
