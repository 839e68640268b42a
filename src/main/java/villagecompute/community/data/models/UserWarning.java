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
 * Warning, suspension or ban issued against a user.
 *
 * <p>
 * Rows are append-only apart from {@code is_active}, which is cleared when a sanction is lifted or a suspension
 * elapses.
 *
 * <p>
 * <b>Blocking rules:</b>
 * <ul>
 * <li>{@link WarningType#BANNED} blocks while active</li>
 * <li>{@link WarningType#SUSPENSION} blocks while active and {@code expires_at} is in the future; without an
 * expiry it does not block</li>
 * <li>{@link WarningType#WARNING} never blocks</li>
 * </ul>
 */
@Entity
@Table(
        name = "user_warnings")
public class UserWarning {

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
            nullable = false)
    public WarningType type;

    @Column(
            nullable = false)
    public String reason;

    @Column(
            name = "issued_by_user_id")
    public UUID issuedByUserId;

    @Column(
            name = "issued_at",
            nullable = false)
    public Instant issuedAt;

    @Column(
            name = "expires_at")
    public Instant expiresAt;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean isActive = true;

    public static UserWarning create(UUID userId, WarningType type, String reason, UUID issuedByUserId,
            Instant issuedAt, Instant expiresAt) {
        UserWarning warning = new UserWarning();
        warning.userId = userId;
        warning.type = type;
        warning.reason = reason;
        warning.issuedByUserId = issuedByUserId;
        warning.issuedAt = issuedAt;
        warning.expiresAt = expiresAt;
        warning.isActive = true;
        return warning;
    }
}
