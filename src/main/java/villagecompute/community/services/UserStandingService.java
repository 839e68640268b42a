package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.StandingDecisionType;
import villagecompute.community.data.models.UserWarning;
import villagecompute.community.data.models.WarningType;
import villagecompute.community.data.repositories.UserRepository;
import villagecompute.community.data.repositories.UserWarningRepository;
import villagecompute.community.exceptions.ResourceNotFoundException;
import villagecompute.community.integration.webhooks.WebhookDispatcher;
import villagecompute.community.observability.CommunityMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Tracks warnings, suspensions and bans, and decides whether a user may currently participate.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Standing check before any content is moderated</li>
 * <li>Admin sanctions: warn, suspend, ban, lift</li>
 * <li>Deactivation of elapsed suspensions</li>
 * </ul>
 *
 * <p>
 * <b>Standing rules:</b> an active ban denies; otherwise an active suspension whose expiry is in the future denies;
 * otherwise the user is allowed. A suspension with no expiry does not deny.
 *
 * <p>
 * <b>Fail-open:</b> if warnings cannot be loaded the user is allowed and the error is logged. A storage outage must
 * not lock every member out of the community.
 */
@ApplicationScoped
public class UserStandingService {

    private static final Logger LOG = Logger.getLogger(UserStandingService.class);

    public static final int DEFAULT_SUSPENSION_DAYS = 7;

    @Inject
    UserWarningRepository warningRepository;

    @Inject
    UserRepository userRepository;

    @Inject
    WebhookDispatcher webhookDispatcher;

    @Inject
    CommunityMetrics metrics;

    Clock clock = Clock.systemUTC();

    /**
     * Checks whether a user may submit content right now. The warning read runs in a separate transaction, so a
     * storage failure here leaves the caller's transaction usable.
     *
     * @param userId
     *            user to check, null is allowed (anonymous handling belongs to the caller)
     * @return allow, or deny with the applicable ban or suspension
     */
    public StandingDecisionType checkStanding(UUID userId) {
        if (userId == null) {
            return StandingDecisionType.allow();
        }
        StandingDecisionType decision;
        try {
            decision = evaluate(warningRepository.findActiveByUser(userId), clock.instant());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Standing check failed for user %s, allowing", userId);
            return StandingDecisionType.allow();
        }
        if (!decision.allowed()) {
            LOG.infof("User %s denied by %s: %s", userId, decision.kind(), decision.reason());
            metrics.incrementStandingDenial(decision.kind().name().toLowerCase(Locale.ROOT));
        }
        return decision;
    }

    /**
     * Applies the standing rules to a set of warnings.
     *
     * @param warnings
     *            the user's warnings, inactive ones are ignored
     * @param now
     *            evaluation time
     * @return standing decision
     */
    public StandingDecisionType evaluate(List<UserWarning> warnings, Instant now) {
        if (warnings == null || warnings.isEmpty()) {
            return StandingDecisionType.allow();
        }
        for (UserWarning warning : warnings) {
            if (warning.isActive && warning.type == WarningType.BANNED) {
                return StandingDecisionType.banned(warning.reason, warning.issuedAt);
            }
        }
        for (UserWarning warning : warnings) {
            if (warning.isActive && warning.type == WarningType.SUSPENSION && warning.expiresAt != null
                    && warning.expiresAt.isAfter(now)) {
                return StandingDecisionType.suspended(warning.reason, warning.issuedAt, warning.expiresAt);
            }
        }
        return StandingDecisionType.allow();
    }

    @Transactional
    public UserWarning issueWarning(UUID userId, UUID adminUserId, String reason) {
        return issue(userId, adminUserId, WarningType.WARNING, reason, null, WebhookDispatcher.EVENT_USER_WARNED);
    }

    /**
     * Suspends a user.
     *
     * @param days
     *            suspension length, {@value #DEFAULT_SUSPENSION_DAYS} when not positive
     */
    @Transactional
    public UserWarning suspend(UUID userId, UUID adminUserId, String reason, int days) {
        int length = days > 0 ? days : DEFAULT_SUSPENSION_DAYS;
        Instant expiresAt = clock.instant().plus(Duration.ofDays(length));
        return issue(userId, adminUserId, WarningType.SUSPENSION, reason, expiresAt,
                WebhookDispatcher.EVENT_USER_SUSPENDED);
    }

    @Transactional
    public UserWarning ban(UUID userId, UUID adminUserId, String reason) {
        return issue(userId, adminUserId, WarningType.BANNED, reason, null, WebhookDispatcher.EVENT_USER_BANNED);
    }

    /**
     * Deactivates a warning, suspension or ban.
     *
     * @throws ResourceNotFoundException
     *             if the warning does not exist
     */
    @Transactional
    public UserWarning liftSanction(UUID warningId, UUID adminUserId) {
        UserWarning warning = warningRepository.findByIdOptional(warningId)
                .orElseThrow(() -> new ResourceNotFoundException("Warning not found: " + warningId));
        if (!warning.isActive) {
            return warning;
        }
        warning.isActive = false;
        warningRepository.persist(warning);

        LOG.infof("Admin %s lifted %s %s for user %s", adminUserId, warning.type, warningId, warning.userId);
        webhookDispatcher.dispatch(WebhookDispatcher.EVENT_SANCTION_LIFTED, payload(warning, adminUserId));
        return warning;
    }

    public List<UserWarning> getWarnings(UUID userId) {
        return warningRepository.findByUser(userId);
    }

    /**
     * Clears the active flag on suspensions that have elapsed.
     *
     * @return number of suspensions deactivated
     */
    @Transactional
    public int deactivateExpiredSuspensions(Instant now) {
        int count = warningRepository.deactivateExpiredSuspensions(now);
        if (count > 0) {
            LOG.infof("Deactivated %d expired suspensions", count);
        }
        return count;
    }

    private UserWarning issue(UUID userId, UUID adminUserId, WarningType type, String reason, Instant expiresAt,
            String event) {
        if (userRepository.findByIdOptional(userId).isEmpty()) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }
        UserWarning warning = UserWarning.create(userId, type, reason, adminUserId, clock.instant(), expiresAt);
        warningRepository.persist(warning);

        LOG.infof("Admin %s issued %s to user %s (expires %s): %s", adminUserId, type, userId, expiresAt, reason);
        webhookDispatcher.dispatch(event, payload(warning, adminUserId));
        return warning;
    }

    private static Map<String, Object> payload(UserWarning warning, UUID adminUserId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("userId", warning.userId.toString());
        payload.put("type", warning.type.name());
        payload.put("reason", warning.reason);
        payload.put("issuedBy", adminUserId == null ? null : adminUserId.toString());
        payload.put("expiresAt", warning.expiresAt == null ? null : warning.expiresAt.toString());
        return payload;
    }
}
