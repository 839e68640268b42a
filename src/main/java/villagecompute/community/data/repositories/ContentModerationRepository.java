package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.community.data.models.ContentKind;
import villagecompute.community.data.models.ContentModeration;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class ContentModerationRepository implements PanacheRepositoryBase<ContentModeration, UUID> {

    public Optional<ContentModeration> findByContent(ContentKind kind, UUID contentId) {
        if (kind == null || contentId == null) {
            return Optional.empty();
        }
        return find("contentKind = ?1 AND contentId = ?2", kind, contentId).firstResultOptional();
    }

    /**
     * Flagged records no admin has reviewed yet, oldest first.
     */
    public List<ContentModeration> findPendingReview(ContentKind kind, int page, int size) {
        return find("contentKind = ?1 AND flagged = true AND moderatedAt IS NULL ORDER BY createdAt ASC", kind)
                .page(page, size).list();
    }

    /**
     * Counts approved content of one kind authored by the user, optionally restricted to content created since
     * {@code since}.
     */
    public long countApprovedByAuthor(UUID authorId, ContentKind kind, Instant since) {
        if (since == null) {
            return count("authorId = ?1 AND contentKind = ?2 AND isApproved = true", authorId, kind);
        }
        return count("authorId = ?1 AND contentKind = ?2 AND isApproved = true AND createdAt >= ?3", authorId, kind,
                since);
    }

    /**
     * Counts content of one kind the user submitted since {@code since}, whatever its moderation outcome.
     */
    public long countByAuthorSince(UUID authorId, ContentKind kind, Instant since) {
        return count("authorId = ?1 AND contentKind = ?2 AND createdAt >= ?3", authorId, kind, since);
    }
}
