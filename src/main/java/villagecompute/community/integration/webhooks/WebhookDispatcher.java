package villagecompute.community.integration.webhooks;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Status;
import jakarta.transaction.Synchronization;
import jakarta.transaction.TransactionSynchronizationRegistry;
import villagecompute.community.observability.CommunityMetrics;

/**
 * Fire-and-forget notification of community events to the automation webhook endpoint.
 *
 * <p>
 * Each event is POSTed as JSON to {@code {webhooks.base-url}/{event}} with the {@code X-API-Key} header. Delivery runs
 * off the caller's thread; failures are logged and counted, never retried and never propagated, so a slow or broken
 * endpoint cannot affect moderation or points outcomes.
 *
 * <p>
 * When called inside an active JTA transaction, delivery is held until that transaction commits and dropped if it
 * rolls back. Outside a transaction the event is scheduled immediately.
 *
 * <p>
 * <b>Events:</b>
 * <ul>
 * <li>{@code level_up} - userId, oldLevel, newLevel, totalPoints</li>
 * <li>{@code badge_earned} - userId, badgeName, badgeDescription, pointsAwarded</li>
 * <li>{@code content_flagged} - contentId, kind, userId, issues, severity</li>
 * <li>{@code content_reviewed} - contentId, kind, authorId, approved, moderatorId</li>
 * <li>{@code user_warned}, {@code user_suspended}, {@code user_banned}, {@code sanction_lifted} - userId, reason,
 * issuedBy, expiresAt</li>
 * <li>{@code reward_claimed} - userId, rewardName, pointsSpent</li>
 * </ul>
 *
 * <p>
 * When {@code webhooks.base-url} is not set, dispatch is a logged no-op.
 */
@ApplicationScoped
public class WebhookDispatcher {

    private static final Logger LOG = Logger.getLogger(WebhookDispatcher.class);

    static final Duration HTTP_TIMEOUT = Duration.ofSeconds(5);

    public static final String EVENT_LEVEL_UP = "level_up";
    public static final String EVENT_BADGE_EARNED = "badge_earned";
    public static final String EVENT_CONTENT_FLAGGED = "content_flagged";
    public static final String EVENT_CONTENT_REVIEWED = "content_reviewed";
    public static final String EVENT_CONTENT_REPORTED = "content_reported";
    public static final String EVENT_USER_WARNED = "user_warned";
    public static final String EVENT_USER_SUSPENDED = "user_suspended";
    public static final String EVENT_USER_BANNED = "user_banned";
    public static final String EVENT_SANCTION_LIFTED = "sanction_lifted";
    public static final String EVENT_REWARD_CLAIMED = "reward_claimed";

    @ConfigProperty(
            name = "webhooks.base-url")
    Optional<String> baseUrl;

    @ConfigProperty(
            name = "webhooks.api-key")
    Optional<String> apiKey;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    CommunityMetrics metrics;

    @Inject
    TransactionSynchronizationRegistry transactionRegistry;

    Executor executor = ForkJoinPool.commonPool();

    private final HttpClient httpClient;

    public WebhookDispatcher() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(HTTP_TIMEOUT).build();
    }

    WebhookDispatcher(HttpClient httpClient, ObjectMapper objectMapper, CommunityMetrics metrics, String baseUrl,
            String apiKey, Executor executor) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.baseUrl = Optional.ofNullable(baseUrl);
        this.apiKey = Optional.ofNullable(apiKey);
        this.executor = executor;
    }

    public boolean isEnabled() {
        return baseUrl.filter(s -> !s.isBlank()).isPresent();
    }

    /**
     * Schedules delivery of {@code event} and returns immediately. Inside a transaction the event waits for commit.
     *
     * @param event
     *            event name, appended to the base URL
     * @param payload
     *            JSON-serializable event data
     */
    public void dispatch(String event, Map<String, Object> payload) {
        if (!isEnabled()) {
            LOG.debugf("Webhooks disabled, skipping event %s", event);
            return;
        }
        Map<String, Object> snapshot = new HashMap<>(payload);
        if (inActiveTransaction()) {
            transactionRegistry.registerInterposedSynchronization(new AfterCommit(event, snapshot));
            LOG.debugf("Webhook %s deferred until commit", event);
            return;
        }
        schedule(event, snapshot);
    }

    private boolean inActiveTransaction() {
        return transactionRegistry != null && transactionRegistry.getTransactionStatus() == Status.STATUS_ACTIVE;
    }

    private void schedule(String event, Map<String, Object> payload) {
        try {
            CompletableFuture.runAsync(() -> send(event, payload), executor);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to schedule webhook %s", event);
            metrics.incrementWebhookDispatched(event, false);
        }
    }

    void send(String event, Map<String, Object> payload) {
        try {
            String body = objectMapper.writeValueAsString(payload);
            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(endpoint(event)))
                    .timeout(HTTP_TIMEOUT).header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body));
            apiKey.filter(s -> !s.isBlank()).ifPresent(key -> builder.header("X-API-Key", key));

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            boolean success = response.statusCode() >= 200 && response.statusCode() < 300;
            if (success) {
                LOG.debugf("Webhook %s delivered (status %d)", event, response.statusCode());
            } else {
                LOG.warnf("Webhook %s rejected with status %d", event, response.statusCode());
            }
            metrics.incrementWebhookDispatched(event, success);
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to serialize webhook payload for %s", event);
            metrics.incrementWebhookDispatched(event, false);
        } catch (IOException | RuntimeException e) {
            LOG.warnf(e, "Webhook %s delivery failed", event);
            metrics.incrementWebhookDispatched(event, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Webhook %s delivery interrupted", event);
            metrics.incrementWebhookDispatched(event, false);
        }
    }

    String endpoint(String event) {
        String base = baseUrl.orElseThrow();
        return base.endsWith("/") ? base + event : base + "/" + event;
    }

    private final class AfterCommit implements Synchronization {

        private final String event;
        private final Map<String, Object> payload;

        AfterCommit(String event, Map<String, Object> payload) {
            this.event = event;
            this.payload = payload;
        }

        @Override
        public void beforeCompletion() {
            // delivery only depends on the outcome
        }

        @Override
        public void afterCompletion(int status) {
            if (status == Status.STATUS_COMMITTED) {
                schedule(event, payload);
            } else {
                LOG.debugf("Webhook %s dropped, transaction ended with status %d", event, status);
            }
        }
    }
}
