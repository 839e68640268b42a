package villagecompute.community.data.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only points history. One row per applied adjustment.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code user_id} (UUID, FK) - User whose balance changed</li>
 * <li>{@code action} (TEXT) - Human-readable reason or {@link PointAction} name</li>
 * <li>{@code points} (INT) - Requested delta, signed</li>
 * <li>{@code balance_after} (INT) - Balance after clamping at zero</li>
 * <li>{@code created_at} (TIMESTAMPTZ)</li>
 * </ul>
 */
@Entity
@Table(
        name = "points_ledger")
public class PointsLedgerEntry {

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
            nullable = false)
    public String action;

    @Column(
            nullable = false)
    public int points;

    @Column(
            name = "balance_after",
            nullable = false)
    public int balanceAfter;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static PointsLedgerEntry create(UUID userId, String action, int points, int balanceAfter, Instant at) {
        PointsLedgerEntry entry = new PointsLedgerEntry();
        entry.userId = userId;
        entry.action = action;
        entry.points = points;
        entry.balanceAfter = balanceAfter;
        entry.createdAt = at;
        return entry;
    }
}
