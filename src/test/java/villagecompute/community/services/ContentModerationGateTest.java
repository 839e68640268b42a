package villagecompute.community.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.community.api.types.GateDecisionType;
import villagecompute.community.api.types.ImageModerationResultType;
import villagecompute.community.data.models.ContentKind;
import villagecompute.community.data.models.MessageType;
import villagecompute.community.observability.CommunityMetrics;

/**
 * Unit tests for {@link ContentModerationGate}.
 *
 * <p>
 * Coverage:
 * <ul>
 * <li>Text-only kinds follow the text verdict</li>
 * <li>Post image limits, filename heuristic and classifier verdicts</li>
 * <li>Classifier failures never block</li>
 * <li>Attachment messages skip the text rule set</li>
 * <li>Decision metrics</li>
 * </ul>
 */
class ContentModerationGateTest {

    private static final UUID USER_ID = UUID.randomUUID();

    @Mock
    ImageModerationService imageModerationService;

    private ContentModerationGate gate;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new SimpleMeterRegistry();
        gate = new ContentModerationGate();
        gate.textModerationService = new TextModerationService();
        gate.imageModerationService = imageModerationService;
        gate.metrics = new CommunityMetrics(registry);
        when(imageModerationService.evaluate(anyString())).thenReturn(ImageModerationResultType.safe());
    }

    @Test
    void testModerate_comment_cleanIsAllowed() {
        GateDecisionType decision = gate.moderate(USER_ID, ContentKind.COMMENT, "Great point, thank you!");

        assertFalse(decision.shouldBlock());
        assertFalse(decision.shouldFlag());
        assertEquals("Great point, thank you!", decision.cleanedContent());
        assertEquals(ContentKind.COMMENT, decision.kind());
    }

    @Test
    void testModerate_feedback_flaggedIsCleaned() {
        GateDecisionType decision = gate.moderate(USER_ID, ContentKind.FEEDBACK, "The session was crap");

        assertTrue(decision.shouldFlag());
        assertEquals("The session was ****", decision.cleanedContent());
        assertEquals(1.0, registry.get("community_moderation_decisions_total").tag("kind", "feedback")
                .tag("outcome", "flagged").counter().count());
    }

    @Test
    void testModerate_hateSpeech_blocked() {
        GateDecisionType decision = gate.moderate(USER_ID, ContentKind.COMMENT, "go die");

        assertTrue(decision.shouldBlock());
        assertTrue(decision.issues().contains("hate_speech"));
    }

    @Test
    void testModeratePost_tooManyImages_blocked() {
        List<String> images = List.of("a.jpg", "b.jpg", "c.jpg", "d.jpg", "e.jpg", "f.jpg");

        GateDecisionType decision = gate.moderatePost(USER_ID, "Photos from the retreat", images);

        assertTrue(decision.shouldBlock());
        assertEquals(List.of(ContentModerationGate.ISSUE_TOO_MANY_IMAGES), decision.issues());
    }

    @Test
    void testModeratePost_fiveImages_allowed() {
        List<String> images = List.of("a.jpg", "b.jpg", "c.jpg", "d.jpg", "e.jpg");

        assertFalse(gate.moderatePost(USER_ID, "Photos from the retreat", images).shouldBlock());
    }

    @Test
    void testModeratePost_nudityFilename_blockedWithoutClassifier() {
        GateDecisionType decision = gate.moderatePost(USER_ID, "check this", List.of("uploads/NSFW_pic.png"));

        assertTrue(decision.shouldBlock());
        assertEquals(List.of(ContentModerationGate.ISSUE_IMAGE_NUDITY_KEYWORDS), decision.issues());
        verify(imageModerationService, never()).evaluate(anyString());
    }

    @Test
    void testModeratePost_explicitImage_blocked() {
        String url = "https://cdn.example.com/upload/123.jpg";
        when(imageModerationService.evaluate(url))
                .thenReturn(new ImageModerationResultType(true, 0.92, List.of("sexual_display")));

        GateDecisionType decision = gate.moderatePost(USER_ID, "Weekend recap", List.of(url));

        assertTrue(decision.shouldBlock());
        assertEquals(List.of(ContentModerationGate.ISSUE_EXPLICIT_IMAGE), decision.issues());
    }

    @Test
    void testModeratePost_classifierFailure_allowed() {
        String url = "https://cdn.example.com/upload/123.jpg";
        when(imageModerationService.evaluate(url)).thenReturn(ImageModerationResultType.failOpen("provider_http_500"));

        GateDecisionType decision = gate.moderatePost(USER_ID, "Weekend recap", List.of(url));

        assertFalse(decision.shouldBlock());
        assertFalse(decision.shouldFlag());
    }

    @Test
    void testModeratePost_localImagesAreNotClassified() {
        gate.moderatePost(USER_ID, "Weekend recap", List.of("uploads/123.jpg"));

        verify(imageModerationService, never()).evaluate(anyString());
    }

    @Test
    void testModeratePost_blockedTextSkipsImages() {
        GateDecisionType decision = gate.moderatePost(USER_ID, "kill yourself",
                List.of("https://cdn.example.com/upload/123.jpg"));

        assertTrue(decision.shouldBlock());
        verify(imageModerationService, never()).evaluate(anyString());
    }

    @Test
    void testModeratePost_flaggedTextWithSafeImages_staysFlagged() {
        GateDecisionType decision = gate.moderatePost(USER_ID, "what a stupid day",
                List.of("https://cdn.example.com/upload/1.jpg"));

        assertTrue(decision.shouldFlag());
        assertFalse(decision.shouldBlock());
        assertEquals("what a **** day", decision.cleanedContent());
    }

    @Test
    void testModerateMessage_text_usesTextRules() {
        GateDecisionType decision = gate.moderateMessage(USER_ID, "you idiot", MessageType.TEXT);

        assertTrue(decision.shouldFlag());
        assertEquals(ContentKind.MESSAGE, decision.kind());
    }

    @Test
    void testModerateMessage_attachment_skipsTextRules() {
        GateDecisionType decision = gate.moderateMessage(USER_ID, "files/stupid-meme.gif", MessageType.FILE);

        assertFalse(decision.shouldBlock());
        assertFalse(decision.shouldFlag());
    }

    @Test
    void testModerateMessage_attachmentNudityName_blocked() {
        GateDecisionType decision = gate.moderateMessage(USER_ID, "files/naked.png", MessageType.IMAGE);

        assertTrue(decision.shouldBlock());
        assertEquals(List.of(ContentModerationGate.ISSUE_IMAGE_NUDITY_KEYWORDS), decision.issues());
    }

    @Test
    void testModerateMessage_explicitImageUrl_blocked() {
        String url = "https://cdn.example.com/m/777.webp?sig=abc";
        when(imageModerationService.evaluate(url))
                .thenReturn(new ImageModerationResultType(true, 0.7, List.of("erotica")));

        assertTrue(gate.moderateMessage(USER_ID, url, MessageType.IMAGE).shouldBlock());
    }

    @Test
    void testModerateMessage_nonImageUrl_notClassified() {
        gate.moderateMessage(USER_ID, "https://cdn.example.com/m/report.pdf", MessageType.FILE);

        verify(imageModerationService, never()).evaluate(anyString());
    }

    @Test
    void testModerateMessage_captionWithExplicitImageUrl_blocked() {
        String url = "https://cdn.example.com/a.png";
        when(imageModerationService.evaluate(url))
                .thenReturn(new ImageModerationResultType(true, 0.9, List.of("sexual_activity")));

        GateDecisionType decision = gate.moderateMessage(USER_ID, "look at this " + url, MessageType.IMAGE);

        assertTrue(decision.shouldBlock());
        assertEquals(List.of(ContentModerationGate.ISSUE_EXPLICIT_IMAGE), decision.issues());
        verify(imageModerationService).evaluate(url);
    }

    @Test
    void testModerateMessage_secondOfTwoImageUrlsExplicit_blocked() {
        String safe = "https://cdn.example.com/ok.png";
        String explicit = "https://cdn.example.com/a.png";
        when(imageModerationService.evaluate(explicit))
                .thenReturn(new ImageModerationResultType(true, 0.6, List.of("erotica")));

        GateDecisionType decision = gate.moderateMessage(USER_ID, safe + " " + explicit, MessageType.IMAGE);

        assertTrue(decision.shouldBlock());
        verify(imageModerationService).evaluate(safe);
        verify(imageModerationService).evaluate(explicit);
    }

    @Test
    void testImageUrls_keepsOnlyImageLinks() {
        assertEquals(List.of("https://a.example.com/x.JPG", "http://b.example.com/y.gif?w=200"),
                ContentModerationGate.imageUrls("see https://a.example.com/x.JPG and https://c.example.com/doc.pdf "
                        + "or http://b.example.com/y.gif?w=200"));
    }
}
