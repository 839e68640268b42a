package villagecompute.community.data.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Community member with the gamification state owned by this service.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier, assigned by the account service</li>
 * <li>{@code username} (TEXT) - Display handle</li>
 * <li>{@code points} (INT) - Current balance, never negative</li>
 * <li>{@code level} (TEXT) - {@link LevelTier} name, always {@code LevelTier.forPoints(points)}</li>
 * <li>{@code completed_courses} (INT) - Courses at 100% progress</li>
 * <li>{@code events_attended} (INT) - Events with confirmed attendance</li>
 * <li>{@code created_at}, {@code updated_at} (TIMESTAMPTZ)</li>
 * </ul>
 *
 * <p>
 * Points are only changed through {@code PointsService}, which holds a row lock for the duration of the update.
 *
 * @see PointsLedgerEntry
 */
@Entity
@Table(
        name = "users")
public class User {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            nullable = false)
    public String username;

    @Column(
            nullable = false)
    public int points;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false)
    public LevelTier level = LevelTier.NEW_MEMBER;

    @Column(
            name = "completed_courses",
            nullable = false)
    public int completedCourses;

    @Column(
            name = "events_attended",
            nullable = false)
    public int eventsAttended;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;
}
