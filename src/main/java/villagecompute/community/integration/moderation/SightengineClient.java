package villagecompute.community.integration.moderation;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.community.exceptions.ImageClassifierException;

/**
 * HTTP client for the Sightengine image moderation API ({@code nudity-2.0} model).
 *
 * <p>
 * The classifier is addressed by image URL; Sightengine fetches the image itself. Responses are JSON with a
 * top-level {@code status} of {@code success} or {@code failure} and a {@code nudity} object holding the
 * sub-scores.
 *
 * <p>
 * Credentials are optional. When either is missing, {@link #isConfigured()} returns false and callers skip
 * classification.
 */
@ApplicationScoped
public class SightengineClient {

    private static final Logger LOG = Logger.getLogger(SightengineClient.class);

    private static final String BASE_URL = "https://api.sightengine.com/1.0/check.json";
    private static final String MODEL = "nudity-2.0";
    static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

    @ConfigProperty(
            name = "sightengine.api-user")
    Optional<String> apiUser;

    @ConfigProperty(
            name = "sightengine.api-secret")
    Optional<String> apiSecret;

    @Inject
    ObjectMapper objectMapper;

    private final HttpClient httpClient;

    public SightengineClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(HTTP_TIMEOUT).build();
    }

    SightengineClient(HttpClient httpClient, ObjectMapper objectMapper, String apiUser, String apiSecret) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiUser = Optional.ofNullable(apiUser);
        this.apiSecret = Optional.ofNullable(apiSecret);
    }

    public boolean isConfigured() {
        return apiUser.filter(s -> !s.isBlank()).isPresent() && apiSecret.filter(s -> !s.isBlank()).isPresent();
    }

    /**
     * Classifies the image at {@code imageUrl}.
     *
     * @param imageUrl
     *            public http(s) URL of the image
     * @return nudity sub-scores
     * @throws ImageClassifierException
     *             on a non-200 response (with the status code), a provider-reported failure, a transport error or an
     *             unparseable body
     */
    public NudityScores checkNudity(String imageUrl) {
        if (!isConfigured()) {
            throw new ImageClassifierException("Sightengine credentials are not configured",
                    ImageClassifierException.NO_STATUS);
        }

        String url = String.format("%s?models=%s&url=%s&api_user=%s&api_secret=%s", BASE_URL, MODEL, encode(imageUrl),
                encode(apiUser.get()), encode(apiSecret.get()));
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(HTTP_TIMEOUT).GET().build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ImageClassifierException("Sightengine request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageClassifierException("Sightengine request interrupted", e);
        }

        if (response.statusCode() != 200) {
            LOG.warnf("Sightengine returned status %d for image %s", response.statusCode(), imageUrl);
            throw new ImageClassifierException("Sightengine API returned status " + response.statusCode(),
                    response.statusCode());
        }

        return parseNudityScores(response.body());
    }

    /**
     * Extracts sub-scores from a {@code check.json} response body. Missing sub-scores read as 0.0.
     *
     * @param body
     *            raw JSON response
     * @return parsed scores
     * @throws ImageClassifierException
     *             if the body is not JSON, reports a failure, or lacks the {@code nudity} object
     */
    NudityScores parseNudityScores(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ImageClassifierException("Invalid response from Sightengine", e);
        }
        if (root == null || !"success".equals(root.path("status").asText())) {
            String message = root == null ? "empty body" : root.path("error").path("message").asText("unknown error");
            throw new ImageClassifierException("Sightengine reported failure: " + message,
                    ImageClassifierException.NO_STATUS);
        }

        JsonNode nudity = root.get("nudity");
        if (nudity == null || !nudity.isObject()) {
            throw new ImageClassifierException("Invalid response from Sightengine: missing nudity scores",
                    ImageClassifierException.NO_STATUS);
        }

        return new NudityScores(nudity.path("sexual_activity").asDouble(0.0),
                nudity.path("sexual_display").asDouble(0.0), nudity.path("erotica").asDouble(0.0),
                nudity.path("suggestive").asDouble(0.0));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
