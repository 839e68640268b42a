package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.ContentSubmissionType;
import villagecompute.community.api.types.EarnedBadgeType;
import villagecompute.community.api.types.GateDecisionType;
import villagecompute.community.api.types.PointsAdjustmentType;
import villagecompute.community.api.types.StandingDecisionType;
import villagecompute.community.api.types.SubmissionResultType;
import villagecompute.community.data.models.ContentKind;
import villagecompute.community.data.models.ContentModeration;
import villagecompute.community.data.models.PointAction;
import villagecompute.community.data.models.StreakType;
import villagecompute.community.data.repositories.ContentModerationRepository;
import villagecompute.community.integration.webhooks.WebhookDispatcher;
import villagecompute.community.observability.LoggingContext;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs a user submission through the full participation pipeline.
 *
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 * <li>Standing check: banned or suspended authors are denied before moderation runs</li>
 * <li>Moderation gate: blocked content stops here and nothing is written</li>
 * <li>Persist through the caller's {@link ContentWriter} (cleaned text when flagged)</li>
 * <li>Record the moderation outcome; flagged content is queued for review</li>
 * <li>Award points for the action and extend the post streak</li>
 * <li>Run one badge eligibility pass</li>
 * </ol>
 *
 * <p>
 * Steps 3 to 6 share one transaction, so a failure after the write rolls back the moderation record and points.
 */
@ApplicationScoped
public class ContentSubmissionService {

    private static final Logger LOG = Logger.getLogger(ContentSubmissionService.class);

    @Inject
    UserStandingService standingService;

    @Inject
    ContentModerationGate moderationGate;

    @Inject
    ContentModerationRepository moderationRepository;

    @Inject
    PointsService pointsService;

    @Inject
    StreakService streakService;

    @Inject
    BadgeService badgeService;

    @Inject
    WebhookDispatcher webhookDispatcher;

    Clock clock = Clock.systemUTC();

    /**
     * Submits content.
     *
     * @param submission
     *            what the user wants to publish
     * @param writer
     *            persists the content once it passes moderation
     * @return outcome, including points and badges earned
     */
    @Transactional
    public SubmissionResultType submit(ContentSubmissionType submission, ContentWriter writer) {
        UUID authorId = submission.authorId();
        LoggingContext.setUserId(authorId);
        LoggingContext.setContentKind(submission.kind());
        try {
            StandingDecisionType standing = standingService.checkStanding(authorId);
            if (!standing.allowed()) {
                return SubmissionResultType.denied(standing);
            }

            GateDecisionType decision = moderate(submission);
            if (decision.shouldBlock()) {
                return SubmissionResultType.blocked(decision);
            }

            UUID contentId = writer.write(submission, decision.cleanedContent(), !decision.shouldFlag());
            recordModeration(submission, contentId, decision);

            PointsAdjustmentType points = awardPoints(submission);
            if (submission.kind() == ContentKind.POST) {
                streakService.recordActivity(authorId, StreakType.POST);
            }
            List<EarnedBadgeType> badges = badgeService.checkEligibility(authorId);

            LOG.debugf("Submission %s %s by %s stored (flagged=%s)", submission.kind(), contentId, authorId,
                    decision.shouldFlag());
            return SubmissionResultType.persisted(contentId, decision, points, badges);
        } finally {
            LoggingContext.clearSubmission();
        }
    }

    private GateDecisionType moderate(ContentSubmissionType submission) {
        return switch (submission.kind()) {
            case POST -> moderationGate.moderatePost(submission.authorId(), submission.content(), submission.images());
            case MESSAGE -> moderationGate.moderateMessage(submission.authorId(), submission.content(),
                    submission.messageType());
            case COMMENT, FEEDBACK -> moderationGate.moderate(submission.authorId(), submission.kind(),
                    submission.content());
        };
    }

    private void recordModeration(ContentSubmissionType submission, UUID contentId, GateDecisionType decision) {
        Instant now = clock.instant();
        ContentModeration record = new ContentModeration();
        record.contentKind = submission.kind();
        record.contentId = contentId;
        record.authorId = submission.authorId();
        record.flagged = decision.shouldFlag();
        record.isApproved = !decision.shouldFlag();
        record.issues = new ArrayList<>(decision.issues());
        record.severity = decision.severity();
        record.originalContent = decision.shouldFlag() ? submission.content() : null;
        record.createdAt = now;
        record.updatedAt = now;
        moderationRepository.persist(record);

        if (decision.shouldFlag()) {
            Map<String, Object> payload = new HashMap<>();
            payload.put("contentId", contentId.toString());
            payload.put("kind", submission.kind().name());
            payload.put("userId", submission.authorId().toString());
            payload.put("issues", decision.issues());
            payload.put("severity", decision.severity());
            webhookDispatcher.dispatch(WebhookDispatcher.EVENT_CONTENT_FLAGGED, payload);
        }
    }

    private PointsAdjustmentType awardPoints(ContentSubmissionType submission) {
        PointAction action = switch (submission.kind()) {
            case POST -> PointAction.CREATE_POST;
            case COMMENT -> PointAction.COMMENT_POST;
            case MESSAGE, FEEDBACK -> null;
        };
        return action == null ? null : pointsService.awardForAction(submission.authorId(), action);
    }
}
