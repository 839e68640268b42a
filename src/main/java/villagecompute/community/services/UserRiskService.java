package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.UserRiskAssessmentType;
import villagecompute.community.data.models.ContentKind;
import villagecompute.community.data.models.User;
import villagecompute.community.data.repositories.ContentModerationRepository;
import villagecompute.community.data.repositories.ContentReportRepository;
import villagecompute.community.data.repositories.UserRepository;
import villagecompute.community.data.repositories.UserWarningRepository;
import villagecompute.community.exceptions.ResourceNotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scores a member's recent behaviour for moderators.
 *
 * <p>
 * <b>Risk score (0-10, capped):</b>
 * <ul>
 * <li>Account younger than 7 days: +2; younger than 30 days: +1</li>
 * <li>More than 20 posts in the last 7 days: +3; more than 10: +1</li>
 * <li>+2 per report against the member in the last 30 days</li>
 * <li>+3 per warning, suspension or ban ever issued</li>
 * </ul>
 */
@ApplicationScoped
public class UserRiskService {

    private static final Logger LOG = Logger.getLogger(UserRiskService.class);

    static final int MAX_SCORE = 10;

    @Inject
    UserRepository userRepository;

    @Inject
    ContentModerationRepository moderationRepository;

    @Inject
    ContentReportRepository reportRepository;

    @Inject
    UserWarningRepository warningRepository;

    Clock clock = Clock.systemUTC();

    @Transactional
    public UserRiskAssessmentType analyzeUser(UUID userId) {
        User user = userRepository.findByIdOptional(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));

        Instant now = clock.instant();
        long accountAgeDays = Math.max(0, Duration.between(user.createdAt, now).toDays());
        long posts = moderationRepository.countByAuthorSince(userId, ContentKind.POST, now.minus(Duration.ofDays(7)));
        long reportsWeek = reportRepository.countAgainstUserSince(userId, now.minus(Duration.ofDays(7)));
        long reportsMonth = reportRepository.countAgainstUserSince(userId, now.minus(Duration.ofDays(30)));
        long warnings = warningRepository.countByUser(userId);

        int score = calculateRiskScore(accountAgeDays, posts, reportsMonth, warnings);
        List<String> recommendations = recommendations(score, reportsWeek);
        LOG.debugf("Risk for user %s: score=%d, posts7d=%d, reports30d=%d, warnings=%d", userId, score, posts,
                reportsMonth, warnings);

        return new UserRiskAssessmentType(userId, accountAgeDays, posts, reportsWeek, reportsMonth, warnings, score,
                recommendations);
    }

    static int calculateRiskScore(long accountAgeDays, long postsLast7Days, long reportsLast30Days, long warnings) {
        long score = 0;
        if (accountAgeDays < 7) {
            score += 2;
        } else if (accountAgeDays < 30) {
            score += 1;
        }
        if (postsLast7Days > 20) {
            score += 3;
        } else if (postsLast7Days > 10) {
            score += 1;
        }
        score += reportsLast30Days * 2;
        score += warnings * 3;
        return (int) Math.min(score, MAX_SCORE);
    }

    static List<String> recommendations(int score, long reportsLast7Days) {
        List<String> recommendations = new ArrayList<>();
        if (score >= 7) {
            recommendations.add("Consider temporary suspension");
            recommendations.add("Require manual approval for future posts");
        } else if (score >= 5) {
            recommendations.add("Increase monitoring frequency");
            recommendations.add("Consider issuing a warning");
        } else if (score >= 3) {
            recommendations.add("Monitor closely for 48 hours");
        }
        if (reportsLast7Days >= 3) {
            recommendations.add("Multiple recent reports - investigate immediately");
        }
        return recommendations;
    }
}
