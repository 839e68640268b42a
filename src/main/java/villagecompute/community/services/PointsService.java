package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.LeaderboardEntryType;
import villagecompute.community.api.types.LevelProgressType;
import villagecompute.community.api.types.PointsAdjustmentType;
import villagecompute.community.data.models.CriteriaTimeframe;
import villagecompute.community.data.models.LevelTier;
import villagecompute.community.data.models.PointAction;
import villagecompute.community.data.models.PointsLedgerEntry;
import villagecompute.community.data.models.User;
import villagecompute.community.data.repositories.PointsLedgerRepository;
import villagecompute.community.data.repositories.UserRepository;
import villagecompute.community.exceptions.ResourceNotFoundException;
import villagecompute.community.integration.webhooks.WebhookDispatcher;
import villagecompute.community.observability.CommunityMetrics;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * PointsService applies points adjustments and keeps each user's level tier in sync with the balance.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Credit and debit points with the balance clamped at zero</li>
 * <li>Recompute the {@link LevelTier} on every change</li>
 * <li>Append a {@link PointsLedgerEntry} per applied adjustment</li>
 * <li>Notify {@code level_up} when the tier changes</li>
 * </ul>
 *
 * <p>
 * <b>Concurrency:</b> the user row is read with a pessimistic write lock, so concurrent adjustments for the same
 * user serialize and none is lost.
 *
 * <p>
 * Affordability is not checked here; a debit larger than the balance leaves the user at zero. Callers that spend
 * points (reward claims) check the balance first.
 *
 * @see LevelTier
 * @see PointAction
 */
@ApplicationScoped
public class PointsService {

    private static final Logger LOG = Logger.getLogger(PointsService.class);

    static final int MAX_LEADERBOARD_SIZE = 100;

    @Inject
    UserRepository userRepository;

    @Inject
    PointsLedgerRepository ledgerRepository;

    @Inject
    WebhookDispatcher webhookDispatcher;

    @Inject
    CommunityMetrics metrics;

    Clock clock = Clock.systemUTC();

    /**
     * Adjusts a user's points.
     *
     * @param userId
     *            user to adjust
     * @param delta
     *            points to add (negative to deduct); zero is ignored
     * @param reason
     *            ledger action text
     * @return before/after snapshot
     * @throws ResourceNotFoundException
     *             if the user does not exist
     */
    @Transactional
    public PointsAdjustmentType addPoints(UUID userId, int delta, String reason) {
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));

        if (delta == 0) {
            LOG.debugf("Ignoring zero points adjustment for user %s (%s)", userId, reason);
            return PointsAdjustmentType.unchanged(userId, user.points, user.level);
        }

        int oldPoints = user.points;
        LevelTier oldLevel = user.level;
        int newPoints = (int) Math.max(0L, Math.min(Integer.MAX_VALUE, (long) oldPoints + delta));
        LevelTier newLevel = LevelTier.forPoints(newPoints);
        Instant now = clock.instant();

        user.points = newPoints;
        user.level = newLevel;
        user.updatedAt = now;
        userRepository.persist(user);

        ledgerRepository.persist(PointsLedgerEntry.create(userId, reason, delta, newPoints, now));
        metrics.incrementPointsAdjustment(delta);

        LOG.infof("Points adjusted for user %s: %d → %d (%+d), reason: %s", userId, oldPoints, newPoints, delta,
                reason);

        PointsAdjustmentType adjustment = new PointsAdjustmentType(userId, delta, oldPoints, newPoints, oldLevel,
                newLevel);
        if (adjustment.levelChanged()) {
            LOG.infof("User %s level changed: %s → %s", userId, oldLevel.displayName(), newLevel.displayName());
            Map<String, Object> payload = new HashMap<>();
            payload.put("userId", userId.toString());
            payload.put("oldLevel", oldLevel.displayName());
            payload.put("newLevel", newLevel.displayName());
            payload.put("totalPoints", newPoints);
            webhookDispatcher.dispatch(WebhookDispatcher.EVENT_LEVEL_UP, payload);
        }
        return adjustment;
    }

    /**
     * Awards the fixed points value of a community action.
     */
    @Transactional
    public PointsAdjustmentType awardForAction(UUID userId, PointAction action) {
        return addPoints(userId, action.points(), action.name());
    }

    public LevelProgressType getLevelProgress(UUID userId) {
        User user = userRepository.findByIdOptional(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
        return LevelProgressType.forPoints(user.points);
    }

    public List<PointsLedgerEntry> getHistory(UUID userId, int limit) {
        return ledgerRepository.findRecentByUser(userId, limit);
    }

    /**
     * Ranks users by points. {@link CriteriaTimeframe#ALL_TIME} ranks by balance; the other timeframes rank by the
     * net ledger total inside the window, so deductions count against the score.
     *
     * @param limit
     *            clamped to 1..{@value #MAX_LEADERBOARD_SIZE}
     */
    @Transactional
    public List<LeaderboardEntryType> getLeaderboard(CriteriaTimeframe timeframe, int limit) {
        int size = Math.min(Math.max(limit, 1), MAX_LEADERBOARD_SIZE);
        Optional<Instant> since = timeframe.windowStart(clock.instant());
        List<LeaderboardEntryType> entries = new ArrayList<>();
        if (since.isEmpty()) {
            for (User user : userRepository.findTopByPoints(size)) {
                entries.add(new LeaderboardEntryType(entries.size() + 1, user.id, user.username, user.points,
                        user.points, user.level));
            }
            return entries;
        }

        List<PointsLedgerRepository.PointsTotal> totals = ledgerRepository.findTopNetTotalsSince(since.get(), size);
        List<UUID> userIds = totals.stream().map(PointsLedgerRepository.PointsTotal::userId).toList();
        Map<UUID, User> users = userRepository.findByIds(userIds).stream()
                .collect(Collectors.toMap(user -> user.id, Function.identity()));
        for (PointsLedgerRepository.PointsTotal total : totals) {
            User user = users.get(total.userId());
            if (user == null) {
                LOG.debugf("Skipping leaderboard entry for missing user %s", total.userId());
                continue;
            }
            entries.add(new LeaderboardEntryType(entries.size() + 1, user.id, user.username, total.points(),
                    user.points, user.level));
        }
        return entries;
    }
}
