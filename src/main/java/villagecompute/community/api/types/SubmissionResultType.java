package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Result of running a submission through standing check, moderation, persistence, points and badges.
 *
 * <p>
 * Only {@link SubmissionStatus#ACCEPTED} and {@link SubmissionStatus#FLAGGED} results carry a {@code contentId}.
 */
public record SubmissionResultType(@JsonProperty("status") SubmissionStatus status,

        @JsonProperty("content_id") UUID contentId,

        @JsonProperty("stored_content") String storedContent,

        @JsonProperty("issues") List<String> issues,

        @JsonProperty("severity") int severity,

        @JsonProperty("standing") StandingDecisionType standing,

        @JsonProperty("points") PointsAdjustmentType points,

        @JsonProperty("earned_badges") List<EarnedBadgeType> earnedBadges) {

    public SubmissionResultType {
        issues = issues == null ? List.of() : List.copyOf(issues);
        earnedBadges = earnedBadges == null ? List.of() : List.copyOf(earnedBadges);
    }

    public static SubmissionResultType denied(StandingDecisionType standing) {
        return new SubmissionResultType(SubmissionStatus.DENIED, null, null, List.of(), 0, standing, null, List.of());
    }

    public static SubmissionResultType blocked(GateDecisionType decision) {
        return new SubmissionResultType(SubmissionStatus.BLOCKED, null, null, decision.issues(), decision.severity(),
                StandingDecisionType.allow(), null, List.of());
    }

    public static SubmissionResultType persisted(UUID contentId, GateDecisionType decision,
            PointsAdjustmentType points, List<EarnedBadgeType> earnedBadges) {
        SubmissionStatus status = decision.shouldFlag() ? SubmissionStatus.FLAGGED : SubmissionStatus.ACCEPTED;
        return new SubmissionResultType(status, contentId, decision.cleanedContent(), decision.issues(),
                decision.severity(), StandingDecisionType.allow(), points, earnedBadges);
    }
}
