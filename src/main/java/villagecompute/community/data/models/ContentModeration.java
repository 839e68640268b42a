package villagecompute.community.data.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Moderation record attached to a persisted post, comment, message or feedback item.
 *
 * <p>
 * Created from the gate verdict at submission time and overwritten by admin review.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code content_kind} (TEXT) - {@link ContentKind}</li>
 * <li>{@code content_id} (UUID) - Identifier returned by the content writer</li>
 * <li>{@code author_id} (UUID, FK) - Submitting user</li>
 * <li>{@code is_approved} (BOOLEAN) - Visible to the community</li>
 * <li>{@code flagged} (BOOLEAN) - Automated filter flagged the content</li>
 * <li>{@code issues} (JSONB) - Issue codes from the filter</li>
 * <li>{@code severity} (INT) - Filter severity score</li>
 * <li>{@code original_content} (TEXT) - Pre-cleaning text, only kept for flagged content</li>
 * <li>{@code moderated_by_user_id} (UUID) - Reviewing admin</li>
 * <li>{@code moderated_at} (TIMESTAMPTZ) - Review time, null while pending</li>
 * <li>{@code notes} (TEXT) - Reviewer notes</li>
 * <li>{@code created_at}, {@code updated_at} (TIMESTAMPTZ)</li>
 * </ul>
 */
@Entity
@Table(
        name = "content_moderation",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"content_kind", "content_id"}))
public class ContentModeration {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "content_kind",
            nullable = false)
    public ContentKind contentKind;

    @Column(
            name = "content_id",
            nullable = false)
    public UUID contentId;

    @Column(
            name = "author_id",
            nullable = false)
    public UUID authorId;

    @Column(
            name = "is_approved",
            nullable = false)
    public boolean isApproved;

    @Column(
            nullable = false)
    public boolean flagged;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(
            nullable = false)
    public List<String> issues = new ArrayList<>();

    @Column(
            nullable = false)
    public int severity;

    @Column(
            name = "original_content")
    public String originalContent;

    @Column(
            name = "moderated_by_user_id")
    public UUID moderatedByUserId;

    @Column(
            name = "moderated_at")
    public Instant moderatedAt;

    @Column
    public String notes;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;
}
