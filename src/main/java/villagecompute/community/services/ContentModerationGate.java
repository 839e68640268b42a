package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.GateDecisionType;
import villagecompute.community.api.types.ImageModerationResultType;
import villagecompute.community.api.types.ModerationVerdictType;
import villagecompute.community.data.models.ContentKind;
import villagecompute.community.data.models.MessageType;
import villagecompute.community.observability.CommunityMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the moderation policy for each content kind before anything is persisted.
 *
 * <p>
 * <b>Policy by kind:</b>
 * <ul>
 * <li>Comments and feedback: text verdict only</li>
 * <li>Posts: text verdict, then at most {@value #MAX_POST_IMAGES} images, no image reference matching the nudity
 * keyword pattern, and no http(s) image the classifier marks explicit</li>
 * <li>Text messages: text verdict</li>
 * <li>Image and file messages: the attachment reference must not match the nudity keyword pattern; every image URL
 * the message contains is classified</li>
 * </ul>
 *
 * <p>
 * Blocks stop at the first failing rule. Image classifier failures never block. Every flagged or blocked decision is
 * logged with the acting user.
 */
@ApplicationScoped
public class ContentModerationGate {

    private static final Logger LOG = Logger.getLogger(ContentModerationGate.class);

    public static final int MAX_POST_IMAGES = 5;

    public static final String ISSUE_TOO_MANY_IMAGES = "too_many_images";
    public static final String ISSUE_IMAGE_NUDITY_KEYWORDS = "image_nudity_keywords";
    public static final String ISSUE_EXPLICIT_IMAGE = "explicit_image";

    private static final Pattern NUDITY_KEYWORDS = Pattern.compile("(nude|naked|porn|xxx|nsfw|explicit|sex|erotic)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HTTP_URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMAGE_EXTENSION = Pattern.compile("\\.(png|jpe?g|gif|webp)(\\?|$)",
            Pattern.CASE_INSENSITIVE);

    @Inject
    TextModerationService textModerationService;

    @Inject
    ImageModerationService imageModerationService;

    @Inject
    CommunityMetrics metrics;

    /**
     * Moderates text-only content.
     *
     * @param actorUserId
     *            submitting user, used for audit logging
     * @param kind
     *            content kind
     * @param content
     *            submitted text
     * @return gate decision
     */
    public GateDecisionType moderate(UUID actorUserId, ContentKind kind, String content) {
        ModerationVerdictType verdict = textModerationService.evaluate(content);
        return record(actorUserId, GateDecisionType.fromVerdict(kind, verdict));
    }

    /**
     * Moderates a post and its image references.
     *
     * @param actorUserId
     *            submitting user
     * @param content
     *            post text
     * @param images
     *            image references (file names or URLs), may be empty
     * @return gate decision
     */
    public GateDecisionType moderatePost(UUID actorUserId, String content, List<String> images) {
        GateDecisionType decision = GateDecisionType.fromVerdict(ContentKind.POST,
                textModerationService.evaluate(content));
        if (!decision.shouldBlock()) {
            decision = screenPostImages(decision, images == null ? List.of() : images);
        }
        return record(actorUserId, decision);
    }

    /**
     * Moderates a direct message. Text messages get the text verdict; attachments are screened by reference.
     *
     * @param actorUserId
     *            sending user
     * @param content
     *            message text, or the attachment reference for non-text messages
     * @param messageType
     *            payload type
     * @return gate decision
     */
    public GateDecisionType moderateMessage(UUID actorUserId, String content, MessageType messageType) {
        if (messageType == null || messageType == MessageType.TEXT) {
            return moderate(actorUserId, ContentKind.MESSAGE, content);
        }

        String reference = content == null ? "" : content;
        GateDecisionType decision = new GateDecisionType(ContentKind.MESSAGE, false, false, reference, List.of(), 0);
        if (NUDITY_KEYWORDS.matcher(reference).find()) {
            return record(actorUserId, decision.block(ISSUE_IMAGE_NUDITY_KEYWORDS));
        }
        for (String url : imageUrls(reference)) {
            ImageModerationResultType result = imageModerationService.evaluate(url);
            if (result.isExplicit()) {
                LOG.debugf("Explicit message image detected (score %.2f, reasons %s): %s", result.score(),
                        result.reasons(), url);
                return record(actorUserId, decision.block(ISSUE_EXPLICIT_IMAGE));
            }
        }
        return record(actorUserId, decision);
    }

    /**
     * Every http(s) token in {@code text} that points at an image file, in order of appearance.
     */
    static List<String> imageUrls(String text) {
        List<String> urls = new ArrayList<>();
        Matcher matcher = HTTP_URL.matcher(text);
        while (matcher.find()) {
            String url = matcher.group();
            if (IMAGE_EXTENSION.matcher(url).find()) {
                urls.add(url);
            }
        }
        return urls;
    }

    private GateDecisionType screenPostImages(GateDecisionType decision, List<String> images) {
        if (images.size() > MAX_POST_IMAGES) {
            return decision.block(ISSUE_TOO_MANY_IMAGES);
        }
        for (String image : images) {
            if (image != null && NUDITY_KEYWORDS.matcher(image).find()) {
                return decision.block(ISSUE_IMAGE_NUDITY_KEYWORDS);
            }
        }
        for (String image : images) {
            if (isHttpUrl(image)) {
                ImageModerationResultType result = imageModerationService.evaluate(image);
                if (result.isExplicit()) {
                    LOG.debugf("Explicit image detected (score %.2f, reasons %s): %s", result.score(),
                            result.reasons(), image);
                    return decision.block(ISSUE_EXPLICIT_IMAGE);
                }
            }
        }
        return decision;
    }

    private GateDecisionType record(UUID actorUserId, GateDecisionType decision) {
        String kind = decision.kind().name().toLowerCase(Locale.ROOT);
        if (decision.shouldBlock()) {
            LOG.warnf("Content blocked: kind=%s, user=%s, issues=%s, severity=%d", kind, actorUserId,
                    decision.issues(), decision.severity());
        } else if (decision.shouldFlag()) {
            LOG.infof("Content flagged: kind=%s, user=%s, issues=%s, severity=%d", kind, actorUserId,
                    decision.issues(), decision.severity());
        }
        metrics.incrementModerationDecision(kind, decision.outcome());
        return decision;
    }

    private static boolean isHttpUrl(String value) {
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
