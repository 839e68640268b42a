package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.community.data.models.ContentKind;
import villagecompute.community.data.models.ContentModeration;
import villagecompute.community.data.repositories.ContentModerationRepository;
import villagecompute.community.exceptions.ResourceNotFoundException;
import villagecompute.community.integration.webhooks.WebhookDispatcher;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin review of moderated content.
 *
 * <p>
 * Approving or rejecting overwrites the automated outcome: the reviewer, time and notes are recorded and
 * {@code isApproved} is set. A later review may overwrite an earlier one. Approving a post re-runs badge eligibility
 * for its author, since post badges count approved posts.
 */
@ApplicationScoped
public class ContentReviewService {

    private static final Logger LOG = Logger.getLogger(ContentReviewService.class);

    @Inject
    ContentModerationRepository moderationRepository;

    @Inject
    BadgeService badgeService;

    @Inject
    WebhookDispatcher webhookDispatcher;

    Clock clock = Clock.systemUTC();

    public List<ContentModeration> findPendingReview(ContentKind kind, int page, int size) {
        return moderationRepository.findPendingReview(kind, page, size);
    }

    @Transactional
    public ContentModeration approve(ContentKind kind, UUID contentId, UUID adminUserId, String notes) {
        return review(kind, contentId, adminUserId, notes, true);
    }

    @Transactional
    public ContentModeration reject(ContentKind kind, UUID contentId, UUID adminUserId, String notes) {
        return review(kind, contentId, adminUserId, notes, false);
    }

    private ContentModeration review(ContentKind kind, UUID contentId, UUID adminUserId, String notes,
            boolean approved) {
        ContentModeration record = moderationRepository.findByContent(kind, contentId).orElseThrow(
                () -> new ResourceNotFoundException("Moderation record not found: " + kind + " " + contentId));

        Instant now = clock.instant();
        record.isApproved = approved;
        record.moderatedByUserId = adminUserId;
        record.moderatedAt = now;
        record.notes = notes;
        record.updatedAt = now;
        moderationRepository.persist(record);

        LOG.infof("Admin %s %s %s %s", adminUserId, approved ? "approved" : "rejected", kind, contentId);

        Map<String, Object> payload = new HashMap<>();
        payload.put("contentId", contentId.toString());
        payload.put("kind", kind.name());
        payload.put("authorId", record.authorId.toString());
        payload.put("approved", approved);
        payload.put("moderatorId", adminUserId == null ? null : adminUserId.toString());
        webhookDispatcher.dispatch(WebhookDispatcher.EVENT_CONTENT_REVIEWED, payload);

        if (approved && kind == ContentKind.POST) {
            badgeService.checkEligibility(record.authorId);
        }
        return record;
    }
}
