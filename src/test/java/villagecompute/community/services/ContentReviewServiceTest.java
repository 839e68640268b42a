package villagecompute.community.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.community.data.models.ContentKind;
import villagecompute.community.data.models.ContentModeration;
import villagecompute.community.data.repositories.ContentModerationRepository;
import villagecompute.community.exceptions.ResourceNotFoundException;
import villagecompute.community.integration.webhooks.WebhookDispatcher;

/**
 * Unit tests for {@link ContentReviewService}.
 */
class ContentReviewServiceTest {

    private static final Instant NOW = Instant.parse("2026-04-02T09:30:00Z");
    private static final UUID ADMIN_ID = UUID.randomUUID();
    private static final UUID AUTHOR_ID = UUID.randomUUID();
    private static final UUID CONTENT_ID = UUID.randomUUID();

    @Mock
    ContentModerationRepository moderationRepository;

    @Mock
    BadgeService badgeService;

    @Mock
    WebhookDispatcher webhookDispatcher;

    @InjectMocks
    ContentReviewService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private ContentModeration flaggedRecord(ContentKind kind) {
        ContentModeration record = new ContentModeration();
        record.id = UUID.randomUUID();
        record.contentKind = kind;
        record.contentId = CONTENT_ID;
        record.authorId = AUTHOR_ID;
        record.flagged = true;
        record.isApproved = false;
        record.issues = new ArrayList<>(List.of("profanity"));
        record.severity = 3;
        when(moderationRepository.findByContent(kind, CONTENT_ID)).thenReturn(Optional.of(record));
        return record;
    }

    @Test
    void testApprove_post_recordsReviewAndChecksBadges() {
        ContentModeration record = flaggedRecord(ContentKind.POST);

        ContentModeration result = service.approve(ContentKind.POST, CONTENT_ID, ADMIN_ID, "Context is fine");

        assertSame(record, result);
        assertTrue(result.isApproved);
        assertEquals(ADMIN_ID, result.moderatedByUserId);
        assertEquals(NOW, result.moderatedAt);
        assertEquals("Context is fine", result.notes);
        verify(moderationRepository).persist(record);
        verify(badgeService).checkEligibility(AUTHOR_ID);
    }

    @Test
    void testApprove_comment_doesNotCheckBadges() {
        flaggedRecord(ContentKind.COMMENT);

        service.approve(ContentKind.COMMENT, CONTENT_ID, ADMIN_ID, null);

        verify(badgeService, never()).checkEligibility(any());
    }

    @Test
    void testReject_recordsReviewWithoutBadgeCheck() {
        flaggedRecord(ContentKind.POST);

        ContentModeration result = service.reject(ContentKind.POST, CONTENT_ID, ADMIN_ID, "Harassing tone");

        assertFalse(result.isApproved);
        assertEquals("Harassing tone", result.notes);
        assertEquals(NOW, result.moderatedAt);
        verify(badgeService, never()).checkEligibility(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testReview_dispatchesContentReviewedWebhook() {
        flaggedRecord(ContentKind.FEEDBACK);

        service.reject(ContentKind.FEEDBACK, CONTENT_ID, ADMIN_ID, "Spam");

        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(webhookDispatcher).dispatch(eq(WebhookDispatcher.EVENT_CONTENT_REVIEWED), payload.capture());
        assertEquals(CONTENT_ID.toString(), payload.getValue().get("contentId"));
        assertEquals("FEEDBACK", payload.getValue().get("kind"));
        assertEquals(false, payload.getValue().get("approved"));
        assertEquals(ADMIN_ID.toString(), payload.getValue().get("moderatorId"));
    }

    @Test
    void testReview_laterDecisionOverwritesEarlier() {
        flaggedRecord(ContentKind.POST);

        service.reject(ContentKind.POST, CONTENT_ID, ADMIN_ID, "First look");
        ContentModeration result = service.approve(ContentKind.POST, CONTENT_ID, ADMIN_ID, "On appeal");

        assertTrue(result.isApproved);
        assertEquals("On appeal", result.notes);
    }

    @Test
    void testApprove_unknownContent_throwsNotFound() {
        when(moderationRepository.findByContent(ContentKind.POST, CONTENT_ID)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> service.approve(ContentKind.POST, CONTENT_ID, ADMIN_ID, null));
        verify(webhookDispatcher, never()).dispatch(any(), anyMap());
    }

    @Test
    void testFindPendingReview_delegatesToRepository() {
        ContentModeration record = flaggedRecord(ContentKind.COMMENT);
        when(moderationRepository.findPendingReview(ContentKind.COMMENT, 0, 20)).thenReturn(List.of(record));

        assertEquals(List.of(record), service.findPendingReview(ContentKind.COMMENT, 0, 20));
    }
}
