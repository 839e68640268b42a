package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.StreakSummaryType;
import villagecompute.community.api.types.StreakUpdateType;
import villagecompute.community.data.models.StreakType;
import villagecompute.community.data.models.UserStreak;
import villagecompute.community.data.repositories.UserStreakRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Tracks daily activity streaks and pays milestone rewards.
 *
 * <p>
 * <b>Streak rules (by UTC calendar day):</b>
 * <ul>
 * <li>Activity on the same day as the last one leaves the streak unchanged</li>
 * <li>Activity on the following day extends it by one</li>
 * <li>Any longer gap restarts it at one</li>
 * </ul>
 *
 * <p>
 * <b>Milestones:</b>
 * <ul>
 * <li>Login: 7 days (25), 14 (50), 30 (100), 100 (250)</li>
 * <li>Post: 7 days (35), 14 (70), 30 (150)</li>
 * <li>Event: 5 (40), 10 (80), 20 (160)</li>
 * </ul>
 */
@ApplicationScoped
public class StreakService {

    private static final Logger LOG = Logger.getLogger(StreakService.class);

    record Milestone(String title, int points) {
    }

    static final Map<StreakType, Map<Integer, Milestone>> MILESTONES = Map.of(StreakType.LOGIN,
            Map.of(7, new Milestone("Weekly Warrior", 25), 14, new Milestone("Consistency Champion", 50), 30,
                    new Milestone("Monthly Master", 100), 100, new Milestone("Century Streak", 250)),
            StreakType.POST,
            Map.of(7, new Milestone("Content Creator", 35), 14, new Milestone("Community Voice", 70), 30,
                    new Milestone("Thought Leader", 150)),
            StreakType.EVENT, Map.of(5, new Milestone("Event Enthusiast", 40), 10,
                    new Milestone("Community Participant", 80), 20, new Milestone("Event Master", 160)));

    @Inject
    UserStreakRepository streakRepository;

    @Inject
    PointsService pointsService;

    Clock clock = Clock.systemUTC();

    /**
     * Records today's activity of the given type and pays a milestone reward when one is reached.
     *
     * @param userId
     *            active user
     * @param type
     *            activity type
     * @return streak state after the activity
     */
    @Transactional
    public StreakUpdateType recordActivity(UUID userId, StreakType type) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        streakRepository.insertIfAbsent(userId, type);
        UserStreak streak = streakRepository.findForUpdate(userId, type).orElseThrow(
                () -> new IllegalStateException("Streak row missing after insert for user " + userId + " " + type));

        boolean advanced = advance(streak, today);
        if (!advanced) {
            return new StreakUpdateType(type, streak.currentCount, streak.longestCount, false, null, 0);
        }
        streakRepository.persist(streak);

        Milestone milestone = MILESTONES.getOrDefault(type, Map.of()).get(streak.currentCount);
        if (milestone == null) {
            return new StreakUpdateType(type, streak.currentCount, streak.longestCount, true, null, 0);
        }

        LOG.infof("User %s reached %d-day %s streak: %s", userId, streak.currentCount, type, milestone.title());
        pointsService.addPoints(userId, milestone.points(),
                String.format("%d-day %s streak: %s", streak.currentCount, type.name().toLowerCase(Locale.ROOT), milestone.title()));
        return new StreakUpdateType(type, streak.currentCount, streak.longestCount, true, milestone.title(),
                milestone.points());
    }

    /**
     * Applies one day's activity to a streak.
     *
     * @return false if activity was already recorded for {@code today}
     */
    boolean advance(UserStreak streak, LocalDate today) {
        LocalDate last = streak.lastActivityDate;
        if (today.equals(last)) {
            return false;
        }
        if (last != null && last.plusDays(1).equals(today)) {
            streak.currentCount++;
        } else {
            streak.currentCount = 1;
        }
        streak.longestCount = Math.max(streak.longestCount, streak.currentCount);
        streak.lastActivityDate = today;
        return true;
    }

    /**
     * Current and longest streak for every {@link StreakType}, with zeros for types the user has no activity for.
     */
    public Map<StreakType, StreakSummaryType> getStreakSummary(UUID userId) {
        Map<StreakType, StreakSummaryType> summary = new EnumMap<>(StreakType.class);
        for (StreakType type : StreakType.values()) {
            summary.put(type, StreakSummaryType.empty(type));
        }
        for (UserStreak streak : streakRepository.findByUser(userId)) {
            summary.put(streak.streakType, new StreakSummaryType(streak.streakType, streak.currentCount,
                    streak.longestCount, streak.lastActivityDate));
        }
        return summary;
    }

    /**
     * Zeroes login streaks with no activity yesterday or today.
     *
     * @return number of streaks reset
     */
    @Transactional
    public int resetBrokenLoginStreaks(LocalDate today) {
        int count = streakRepository.resetInactiveSince(StreakType.LOGIN, today.minusDays(1));
        if (count > 0) {
            LOG.infof("Reset %d broken login streaks", count);
        }
        return count;
    }
}
