package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.EarnedBadgeType;
import villagecompute.community.data.models.Badge;
import villagecompute.community.data.models.BadgeCriteriaType;
import villagecompute.community.data.models.User;
import villagecompute.community.data.models.UserAchievement;
import villagecompute.community.data.repositories.BadgeAwardRepository;
import villagecompute.community.data.repositories.BadgeRepository;
import villagecompute.community.data.repositories.UserAchievementRepository;
import villagecompute.community.data.repositories.UserRepository;
import villagecompute.community.exceptions.DuplicateResourceException;
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
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;

/**
 * BadgeService decides which badges a user has newly earned and records the awards.
 *
 * <p>
 * <b>Eligibility pass:</b>
 * <ol>
 * <li>Candidates are the active badges the user does not hold</li>
 * <li>The statistics every candidate needs are read once, before any award</li>
 * <li>Each qualifying badge is written with an insert-if-absent; a concurrent pass that already wrote it wins and
 * this pass skips it silently</li>
 * <li>Each new award grants the badge's reward points, adds a profile achievement and notifies
 * {@code badge_earned}</li>
 * </ol>
 *
 * <p>
 * Reward points granted during a pass do not make further badges eligible in the same pass; they are picked up by
 * the next pass. Custom criteria never qualify automatically and are awarded by an admin.
 *
 * @see UserStatsService
 */
@ApplicationScoped
public class BadgeService {

    private static final Logger LOG = Logger.getLogger(BadgeService.class);

    @Inject
    BadgeRepository badgeRepository;

    @Inject
    BadgeAwardRepository awardRepository;

    @Inject
    UserAchievementRepository achievementRepository;

    @Inject
    UserRepository userRepository;

    @Inject
    UserStatsService statsService;

    @Inject
    PointsService pointsService;

    @Inject
    WebhookDispatcher webhookDispatcher;

    @Inject
    CommunityMetrics metrics;

    Clock clock = Clock.systemUTC();

    /**
     * Runs one eligibility pass for a user.
     *
     * @param userId
     *            user to evaluate
     * @return badges newly awarded by this pass, possibly empty
     * @throws ResourceNotFoundException
     *             if the user does not exist
     */
    @Transactional
    public List<EarnedBadgeType> checkEligibility(UUID userId) {
        User user = userRepository.findByIdOptional(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));

        Set<UUID> held = awardRepository.findBadgeIdsByUser(userId);
        List<Badge> candidates = badgeRepository.findActive().stream().filter(badge -> !held.contains(badge.id))
                .toList();
        if (candidates.isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        UserStatsSnapshot snapshot = statsService.snapshot(user, candidates, now);
        List<Badge> qualifying = candidates.stream().filter(badge -> qualifies(badge, snapshot)).toList();

        List<EarnedBadgeType> earned = new ArrayList<>();
        for (Badge badge : qualifying) {
            award(badge, userId, null, now).ifPresent(earned::add);
        }
        if (!earned.isEmpty()) {
            LOG.infof("User %s earned %d badge(s): %s", userId, earned.size(),
                    earned.stream().map(EarnedBadgeType::name).toList());
        }
        return earned;
    }

    /**
     * Awards a badge manually, regardless of its criteria.
     *
     * @param badgeId
     *            badge to award
     * @param userId
     *            recipient
     * @param adminUserId
     *            awarding admin
     * @return the new award
     * @throws ResourceNotFoundException
     *             if the badge or user does not exist
     * @throws DuplicateResourceException
     *             if the user already has the badge
     */
    @Transactional
    public EarnedBadgeType awardBadge(UUID badgeId, UUID userId, UUID adminUserId) {
        Badge badge = badgeRepository.findByIdOptional(badgeId)
                .orElseThrow(() -> new ResourceNotFoundException("Badge not found: " + badgeId));
        if (userRepository.findByIdOptional(userId).isEmpty()) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }

        EarnedBadgeType earned = award(badge, userId, adminUserId, clock.instant())
                .orElseThrow(() -> new DuplicateResourceException("User already has this badge"));
        LOG.infof("Admin %s awarded badge '%s' to user %s", adminUserId, badge.name, userId);
        return earned;
    }

    public List<Badge> findEarnedBadges(UUID userId) {
        return badgeRepository.findByIds(new ArrayList<>(awardRepository.findBadgeIdsByUser(userId)));
    }

    /**
     * Whether the snapshot satisfies the badge's criterion.
     */
    boolean qualifies(Badge badge, UserStatsSnapshot snapshot) {
        if (badge.criteriaType == BadgeCriteriaType.CUSTOM) {
            return false;
        }
        OptionalLong actual = snapshot.get(badge.criteriaType, badge.criteriaTimeframe);
        return actual.isPresent() && badge.criteriaOperator.test(actual.getAsLong(), badge.criteriaValue);
    }

    private Optional<EarnedBadgeType> award(Badge badge, UUID userId, UUID adminUserId, Instant now) {
        if (!awardRepository.insertIfAbsent(badge.id, userId, adminUserId, now)) {
            LOG.debugf("Badge '%s' already held by user %s, skipping", badge.name, userId);
            return Optional.empty();
        }

        if (badge.rewardPoints > 0) {
            pointsService.addPoints(userId, badge.rewardPoints, "Badge earned: " + badge.name);
        }
        achievementRepository.persist(UserAchievement.forBadge(userId, badge, now));
        metrics.incrementBadgeAwarded(badge.name);

        Map<String, Object> payload = new HashMap<>();
        payload.put("userId", userId.toString());
        payload.put("badgeName", badge.name);
        payload.put("badgeDescription", badge.description);
        payload.put("pointsAwarded", badge.rewardPoints);
        webhookDispatcher.dispatch(WebhookDispatcher.EVENT_BADGE_EARNED, payload);

        return Optional.of(EarnedBadgeType.from(badge, now));
    }
}
