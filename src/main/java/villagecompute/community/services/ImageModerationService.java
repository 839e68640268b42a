package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.ImageModerationResultType;
import villagecompute.community.exceptions.ImageClassifierException;
import villagecompute.community.integration.moderation.NudityScores;
import villagecompute.community.integration.moderation.SightengineClient;
import villagecompute.community.observability.CommunityMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether an image is explicit using the external nudity classifier.
 *
 * <p>
 * An image is explicit when any sub-score strictly exceeds its threshold:
 * <ul>
 * <li>sexual_activity &gt; 0.3</li>
 * <li>sexual_display &gt; 0.3</li>
 * <li>erotica &gt; 0.5</li>
 * <li>suggestive &gt; 0.8</li>
 * </ul>
 * The reported score is the highest triggered sub-score.
 *
 * <p>
 * <b>Fail-open:</b> when the classifier is not configured, answers with a non-200 status or cannot be reached, the
 * image is treated as non-explicit and the failure is logged and counted. Classifier outages never block content.
 */
@ApplicationScoped
public class ImageModerationService {

    private static final Logger LOG = Logger.getLogger(ImageModerationService.class);

    public static final String REASON_NOT_CONFIGURED = "provider_not_configured";
    public static final String REASON_HTTP_PREFIX = "provider_http_";
    public static final String REASON_ERROR = "provider_error";

    @Inject
    SightengineClient client;

    @Inject
    CommunityMetrics metrics;

    @ConfigProperty(
            name = "moderation.image.sexual-activity-threshold",
            defaultValue = "0.3")
    double sexualActivityThreshold = 0.3;

    @ConfigProperty(
            name = "moderation.image.sexual-display-threshold",
            defaultValue = "0.3")
    double sexualDisplayThreshold = 0.3;

    @ConfigProperty(
            name = "moderation.image.erotica-threshold",
            defaultValue = "0.5")
    double eroticaThreshold = 0.5;

    @ConfigProperty(
            name = "moderation.image.suggestive-threshold",
            defaultValue = "0.8")
    double suggestiveThreshold = 0.8;

    /**
     * Classifies one image URL.
     *
     * @param imageUrl
     *            http(s) URL of the image
     * @return explicit verdict, or a fail-open result carrying the failure reason
     */
    public ImageModerationResultType evaluate(String imageUrl) {
        if (!client.isConfigured()) {
            return failOpen(imageUrl, REASON_NOT_CONFIGURED, null);
        }

        NudityScores scores;
        try {
            scores = client.checkNudity(imageUrl);
        } catch (ImageClassifierException e) {
            String reason = e.hasStatusCode() ? REASON_HTTP_PREFIX + e.getStatusCode() : REASON_ERROR;
            return failOpen(imageUrl, reason, e);
        } catch (RuntimeException e) {
            return failOpen(imageUrl, REASON_ERROR, e);
        }

        return classify(scores);
    }

    ImageModerationResultType classify(NudityScores scores) {
        List<String> reasons = new ArrayList<>();
        double score = 0.0;
        if (scores.sexualActivity() > sexualActivityThreshold) {
            reasons.add("sexual_activity");
            score = Math.max(score, scores.sexualActivity());
        }
        if (scores.sexualDisplay() > sexualDisplayThreshold) {
            reasons.add("sexual_display");
            score = Math.max(score, scores.sexualDisplay());
        }
        if (scores.erotica() > eroticaThreshold) {
            reasons.add("erotica");
            score = Math.max(score, scores.erotica());
        }
        if (scores.suggestive() > suggestiveThreshold) {
            reasons.add("suggestive");
            score = Math.max(score, scores.suggestive());
        }
        return new ImageModerationResultType(!reasons.isEmpty(), score, reasons);
    }

    private ImageModerationResultType failOpen(String imageUrl, String reason, Exception cause) {
        if (cause == null) {
            LOG.debugf("Image moderation skipped for %s: %s", imageUrl, reason);
        } else {
            LOG.warnf(cause, "Image moderation failed for %s (%s), allowing image", imageUrl, reason);
        }
        metrics.incrementImageModerationFailure(reason);
        return ImageModerationResultType.failOpen(reason);
    }
}
