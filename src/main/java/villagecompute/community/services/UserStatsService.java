package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.community.data.models.Badge;
import villagecompute.community.data.models.BadgeCriteriaType;
import villagecompute.community.data.models.ContentKind;
import villagecompute.community.data.models.CriteriaTimeframe;
import villagecompute.community.data.models.StreakType;
import villagecompute.community.data.models.User;
import villagecompute.community.data.repositories.ContentModerationRepository;
import villagecompute.community.data.repositories.PointsLedgerRepository;
import villagecompute.community.data.repositories.UserStreakRepository;
import villagecompute.community.services.UserStatsSnapshot.MetricKey;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Computes the statistics badge criteria are measured against.
 *
 * <p>
 * Only the (type, timeframe) pairs the given badges reference are computed, and each at most once. Timeframes apply
 * to points and content counts; course, event and streak statistics are lifetime values.
 */
@ApplicationScoped
public class UserStatsService {

    @Inject
    PointsLedgerRepository ledgerRepository;

    @Inject
    ContentModerationRepository moderationRepository;

    @Inject
    UserStreakRepository streakRepository;

    /**
     * Takes a snapshot of the statistics needed to evaluate {@code badges} for {@code user}.
     *
     * @param user
     *            user whose statistics are read
     * @param badges
     *            badges to be evaluated
     * @param now
     *            reference time for timeframe windows
     * @return snapshot, without entries for custom criteria
     */
    public UserStatsSnapshot snapshot(User user, Collection<Badge> badges, Instant now) {
        Map<MetricKey, Long> values = new HashMap<>();
        for (Badge badge : badges) {
            MetricKey key = new MetricKey(badge.criteriaType, badge.criteriaTimeframe);
            if (badge.criteriaType == BadgeCriteriaType.CUSTOM || values.containsKey(key)) {
                continue;
            }
            values.put(key, compute(user, badge.criteriaType, badge.criteriaTimeframe, now));
        }
        return new UserStatsSnapshot(values);
    }

    private long compute(User user, BadgeCriteriaType type, CriteriaTimeframe timeframe, Instant now) {
        Instant since = timeframe == null ? null : timeframe.windowStart(now).orElse(null);
        return switch (type) {
            case POINTS -> since == null ? user.points : ledgerRepository.sumEarnedSince(user.id, since);
            case POSTS -> moderationRepository.countApprovedByAuthor(user.id, ContentKind.POST, since);
            case COMMENTS -> moderationRepository.countApprovedByAuthor(user.id, ContentKind.COMMENT, since);
            case COURSES -> user.completedCourses;
            case EVENTS -> user.eventsAttended;
            case STREAK -> streakRepository.currentCount(user.id, StreakType.LOGIN);
            case CUSTOM -> throw new IllegalArgumentException("Custom criteria have no statistic");
        };
    }
}
