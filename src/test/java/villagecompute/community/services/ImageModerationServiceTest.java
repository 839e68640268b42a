package villagecompute.community.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.community.api.types.ImageModerationResultType;
import villagecompute.community.exceptions.ImageClassifierException;
import villagecompute.community.integration.moderation.NudityScores;
import villagecompute.community.integration.moderation.SightengineClient;
import villagecompute.community.observability.CommunityMetrics;

/**
 * Unit tests for {@link ImageModerationService}.
 *
 * <p>
 * Coverage:
 * <ul>
 * <li>Threshold boundaries for each sub-score</li>
 * <li>Score is the highest triggered sub-score</li>
 * <li>Fail-open reasons for missing configuration, HTTP errors and transport errors</li>
 * </ul>
 */
class ImageModerationServiceTest {

    private static final String IMAGE_URL = "https://cdn.example.com/photo.jpg";

    @Mock
    SightengineClient client;

    @InjectMocks
    ImageModerationService service;

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new SimpleMeterRegistry();
        service.metrics = new CommunityMetrics(registry);
        when(client.isConfigured()).thenReturn(true);
    }

    @Test
    void testEvaluate_lowScores_notExplicit() {
        when(client.checkNudity(IMAGE_URL)).thenReturn(new NudityScores(0.01, 0.02, 0.1, 0.2));

        ImageModerationResultType result = service.evaluate(IMAGE_URL);

        assertFalse(result.isExplicit());
        assertEquals(0.0, result.score());
        assertTrue(result.reasons().isEmpty());
    }

    @Test
    void testEvaluate_sexualActivityAboveThreshold_explicit() {
        when(client.checkNudity(IMAGE_URL)).thenReturn(new NudityScores(0.31, 0.0, 0.0, 0.0));

        ImageModerationResultType result = service.evaluate(IMAGE_URL);

        assertTrue(result.isExplicit());
        assertEquals(0.31, result.score(), 1e-9);
        assertEquals(List.of("sexual_activity"), result.reasons());
    }

    @Test
    void testEvaluate_exactlyAtThreshold_notExplicit() {
        when(client.checkNudity(IMAGE_URL)).thenReturn(new NudityScores(0.3, 0.3, 0.5, 0.8));

        assertFalse(service.evaluate(IMAGE_URL).isExplicit());
    }

    @Test
    void testEvaluate_multipleTriggers_scoreIsMaximum() {
        when(client.checkNudity(IMAGE_URL)).thenReturn(new NudityScores(0.0, 0.4, 0.9, 0.85));

        ImageModerationResultType result = service.evaluate(IMAGE_URL);

        assertTrue(result.isExplicit());
        assertEquals(0.9, result.score(), 1e-9);
        assertEquals(List.of("sexual_display", "erotica", "suggestive"), result.reasons());
    }

    @Test
    void testEvaluate_suggestiveOnlyAboveItsOwnThreshold() {
        when(client.checkNudity(IMAGE_URL)).thenReturn(new NudityScores(0.0, 0.0, 0.0, 0.79));

        assertFalse(service.evaluate(IMAGE_URL).isExplicit());
    }

    @Test
    void testEvaluate_notConfigured_failsOpen() {
        when(client.isConfigured()).thenReturn(false);

        ImageModerationResultType result = service.evaluate(IMAGE_URL);

        assertFalse(result.isExplicit());
        assertEquals(List.of("provider_not_configured"), result.reasons());
        verify(client, never()).checkNudity(anyString());
        assertEquals(1.0, registry.get("community_image_moderation_failures_total")
                .tag("reason", "provider_not_configured").counter().count());
    }

    @Test
    void testEvaluate_httpError_failsOpenWithStatus() {
        when(client.checkNudity(IMAGE_URL)).thenThrow(new ImageClassifierException("quota", 429));

        ImageModerationResultType result = service.evaluate(IMAGE_URL);

        assertFalse(result.isExplicit());
        assertEquals(List.of("provider_http_429"), result.reasons());
    }

    @Test
    void testEvaluate_transportError_failsOpen() {
        when(client.checkNudity(IMAGE_URL))
                .thenThrow(new ImageClassifierException("timeout", new java.io.IOException("timed out")));

        ImageModerationResultType result = service.evaluate(IMAGE_URL);

        assertFalse(result.isExplicit());
        assertEquals(List.of("provider_error"), result.reasons());
    }

    @Test
    void testEvaluate_unexpectedRuntimeError_failsOpen() {
        when(client.checkNudity(IMAGE_URL)).thenThrow(new IllegalStateException("boom"));

        assertEquals(List.of("provider_error"), service.evaluate(IMAGE_URL).reasons());
    }
}
