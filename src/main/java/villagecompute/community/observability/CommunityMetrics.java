package villagecompute.community.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custom counters for the moderation and gamification core.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li>{@code community_moderation_decisions_total{kind,outcome}} - Gate decisions (allowed, flagged, blocked)</li>
 * <li>{@code community_standing_denials_total{kind}} - Submissions denied by a ban or suspension</li>
 * <li>{@code community_image_moderation_failures_total{reason}} - Classifier failures that failed open</li>
 * <li>{@code community_badges_awarded_total{badge}} - Badge awards written</li>
 * <li>{@code community_points_adjustments_total{direction}} - Applied points adjustments</li>
 * <li>{@code community_content_reports_total{reason,priority}} - Content reports filed by members</li>
 * <li>{@code community_webhooks_dispatched_total{event,result}} - Outbound webhook attempts</li>
 * </ul>
 *
 * <p>
 * Counters are created lazily and cached per tag combination.
 */
@ApplicationScoped
public class CommunityMetrics {

    @Inject
    MeterRegistry registry;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public CommunityMetrics() {
    }

    public CommunityMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementModerationDecision(String kind, String outcome) {
        increment("community_moderation_decisions_total", "Moderation gate decisions",
                List.of(Tag.of("kind", kind), Tag.of("outcome", outcome)));
    }

    public void incrementStandingDenial(String kind) {
        increment("community_standing_denials_total", "Submissions denied by user standing",
                List.of(Tag.of("kind", kind)));
    }

    public void incrementImageModerationFailure(String reason) {
        increment("community_image_moderation_failures_total", "Image classifier failures that failed open",
                List.of(Tag.of("reason", reason)));
    }

    public void incrementBadgeAwarded(String badgeName) {
        increment("community_badges_awarded_total", "Badge awards written", List.of(Tag.of("badge", badgeName)));
    }

    public void incrementPointsAdjustment(int delta) {
        increment("community_points_adjustments_total", "Applied points adjustments",
                List.of(Tag.of("direction", delta >= 0 ? "credit" : "debit")));
    }

    public void incrementContentReport(String reason, String priority) {
        increment("community_content_reports_total", "Content reports filed",
                List.of(Tag.of("reason", reason), Tag.of("priority", priority)));
    }

    public void incrementWebhookDispatched(String event, boolean success) {
        increment("community_webhooks_dispatched_total", "Outbound webhook attempts",
                List.of(Tag.of("event", event), Tag.of("result", success ? "success" : "failure")));
    }

    private void increment(String name, String description, List<Tag> tags) {
        String key = name + tags;
        Counter counter = counters.computeIfAbsent(key,
                k -> Counter.builder(name).description(description).tags(tags).register(registry));
        counter.increment();
    }
}
