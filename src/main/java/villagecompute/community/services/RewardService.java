package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.PointsAdjustmentType;
import villagecompute.community.api.types.RewardClaimResultType;
import villagecompute.community.api.types.RewardEligibilityType;
import villagecompute.community.data.models.Reward;
import villagecompute.community.data.models.RewardClaim;
import villagecompute.community.data.models.RewardClaimStatus;
import villagecompute.community.data.models.User;
import villagecompute.community.data.repositories.RewardClaimRepository;
import villagecompute.community.data.repositories.RewardRepository;
import villagecompute.community.data.repositories.UserRepository;
import villagecompute.community.exceptions.ResourceNotFoundException;
import villagecompute.community.exceptions.ValidationException;
import villagecompute.community.integration.webhooks.WebhookDispatcher;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * RewardService lets users spend points on rewards.
 *
 * <p>
 * <b>Eligibility rules, checked in order:</b>
 * <ol>
 * <li>Reward is active</li>
 * <li>Stock remains (or is unlimited)</li>
 * <li>User has at least the points cost</li>
 * <li>User's level is at least the required level</li>
 * <li>User is under the per-user claim limit</li>
 * <li>Availability window has started and not ended</li>
 * </ol>
 *
 * <p>
 * A claim locks the user row, re-checks eligibility, reserves one stock unit with a conditional update, deducts the
 * points and records the claim in one transaction.
 */
@ApplicationScoped
public class RewardService {

    private static final Logger LOG = Logger.getLogger(RewardService.class);

    @Inject
    RewardRepository rewardRepository;

    @Inject
    RewardClaimRepository claimRepository;

    @Inject
    UserRepository userRepository;

    @Inject
    PointsService pointsService;

    @Inject
    WebhookDispatcher webhookDispatcher;

    Clock clock = Clock.systemUTC();

    /**
     * Applies the eligibility rules.
     *
     * @param reward
     *            reward to claim
     * @param user
     *            claiming user
     * @param userClaims
     *            claims the user already made for this reward
     * @param now
     *            evaluation time
     * @return eligible, or the first failing rule's reason
     */
    public RewardEligibilityType evaluateEligibility(Reward reward, User user, long userClaims, Instant now) {
        if (!reward.isActive) {
            return RewardEligibilityType.ineligible("Reward is not active");
        }
        if (reward.isOutOfStock()) {
            return RewardEligibilityType.ineligible("Reward is out of stock");
        }
        if (user.points < reward.pointsCost) {
            return RewardEligibilityType.ineligible("Insufficient points");
        }
        if (reward.levelRequired != null && (user.level == null || !user.level.isAtLeast(reward.levelRequired))) {
            return RewardEligibilityType.ineligible("Requires level " + reward.levelRequired.displayName());
        }
        if (reward.maxPerUser != null && userClaims >= reward.maxPerUser) {
            return RewardEligibilityType.ineligible("Maximum claims reached for this reward");
        }
        if (reward.startsAt != null && now.isBefore(reward.startsAt)) {
            return RewardEligibilityType.ineligible("Reward not yet available");
        }
        if (reward.endsAt != null && now.isAfter(reward.endsAt)) {
            return RewardEligibilityType.ineligible("Reward period has ended");
        }
        return RewardEligibilityType.eligible();
    }

    public RewardEligibilityType checkEligibility(UUID rewardId, UUID userId) {
        Reward reward = findReward(rewardId);
        User user = userRepository.findByIdOptional(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
        return evaluateEligibility(reward, user, claimRepository.countByRewardAndUser(rewardId, userId),
                clock.instant());
    }

    /**
     * Claims a reward for a user.
     *
     * @param rewardId
     *            reward to claim
     * @param userId
     *            claiming user
     * @param shippingAddress
     *            delivery address for physical rewards, may be null
     * @return claim summary
     * @throws ResourceNotFoundException
     *             if the reward or user does not exist
     * @throws ValidationException
     *             if the user is not eligible or the last unit was taken concurrently
     */
    @Transactional
    public RewardClaimResultType claim(UUID rewardId, UUID userId, String shippingAddress) {
        Reward reward = findReward(rewardId);
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
        Instant now = clock.instant();

        RewardEligibilityType eligibility = evaluateEligibility(reward, user,
                claimRepository.countByRewardAndUser(rewardId, userId), now);
        if (!eligibility.canClaim()) {
            throw new ValidationException(eligibility.reason());
        }
        if (!rewardRepository.reserveUnit(rewardId)) {
            throw new ValidationException("Reward is out of stock");
        }

        PointsAdjustmentType adjustment = pointsService.addPoints(userId, -reward.pointsCost,
                "Claimed reward: " + reward.name);

        RewardClaim claim = new RewardClaim();
        claim.rewardId = rewardId;
        claim.userId = userId;
        claim.pointsSpent = reward.pointsCost;
        claim.status = RewardClaimStatus.PENDING;
        claim.shippingAddress = shippingAddress;
        claim.claimedAt = now;
        claimRepository.persist(claim);

        LOG.infof("User %s claimed reward '%s' for %d points", userId, reward.name, reward.pointsCost);

        Map<String, Object> payload = new HashMap<>();
        payload.put("userId", userId.toString());
        payload.put("rewardName", reward.name);
        payload.put("pointsSpent", reward.pointsCost);
        webhookDispatcher.dispatch(WebhookDispatcher.EVENT_REWARD_CLAIMED, payload);

        return new RewardClaimResultType(claim.id, rewardId, reward.name, reward.pointsCost, adjustment.newPoints());
    }

    private Reward findReward(UUID rewardId) {
        return rewardRepository.findByIdOptional(rewardId)
                .orElseThrow(() -> new ResourceNotFoundException("Reward not found: " + rewardId));
    }
}
