package villagecompute.community.data.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A member's report against a post, comment, message or another member.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code reporter_id} (UUID, FK) - Reporting user</li>
 * <li>{@code target_type} (TEXT) - {@link ReportTarget}</li>
 * <li>{@code target_id} (UUID) - Reported content or user</li>
 * <li>{@code reported_user_id} (UUID, FK) - Author of the reported content</li>
 * <li>{@code reason} (TEXT) - {@link ReportReason}</li>
 * <li>{@code description} (TEXT) - Reporter's note with personal information removed</li>
 * <li>{@code status} (TEXT) - {@link ReportStatus}</li>
 * <li>{@code priority} (TEXT) - {@link ReportPriority}</li>
 * <li>{@code severity} (INT) - Text filter severity of the reported content</li>
 * <li>{@code issues} (JSONB) - Text filter issue codes</li>
 * <li>{@code resolved_by_user_id}, {@code resolved_at}, {@code resolution}, {@code action_taken} - Moderator
 * outcome</li>
 * <li>{@code created_at}, {@code updated_at} (TIMESTAMPTZ)</li>
 * </ul>
 */
@Entity
@Table(
        name = "content_reports")
public class ContentReport {

    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "reporter_id",
            nullable = false)
    public UUID reporterId;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "target_type",
            nullable = false)
    public ReportTarget targetType;

    @Column(
            name = "target_id",
            nullable = false)
    public UUID targetId;

    @Column(
            name = "reported_user_id",
            nullable = false)
    public UUID reportedUserId;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false)
    public ReportReason reason;

    @Column(
            length = MAX_DESCRIPTION_LENGTH)
    public String description;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false)
    public ReportStatus status = ReportStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false)
    public ReportPriority priority = ReportPriority.MEDIUM;

    @Column(
            nullable = false)
    public int severity;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(
            nullable = false)
    public List<String> issues = new ArrayList<>();

    @Column(
            name = "resolved_by_user_id")
    public UUID resolvedByUserId;

    @Column(
            name = "resolved_at")
    public Instant resolvedAt;

    public String resolution;

    @Column(
            name = "action_taken")
    public String actionTaken;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Closes the report with a moderator outcome.
     *
     * @param status
     *            {@link ReportStatus#RESOLVED} or {@link ReportStatus#DISMISSED}
     */
    public void close(ReportStatus status, UUID moderatorId, String resolution, String actionTaken, Instant at) {
        this.status = status;
        this.resolvedByUserId = moderatorId;
        this.resolution = resolution;
        this.actionTaken = actionTaken;
        this.resolvedAt = at;
        this.updatedAt = at;
    }
}
