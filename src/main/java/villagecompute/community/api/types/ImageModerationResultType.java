package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of classifying a single image URL.
 *
 * <p>
 * When the classifier is unavailable the result is non-explicit with a single reason code describing the failure
 * ({@code provider_not_configured}, {@code provider_http_<status>} or {@code provider_error}).
 */
public record ImageModerationResultType(@JsonProperty("is_explicit") boolean isExplicit,

        @JsonProperty("score") double score,

        @JsonProperty("reasons") List<String> reasons) {

    public ImageModerationResultType {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static ImageModerationResultType safe() {
        return new ImageModerationResultType(false, 0.0, List.of());
    }

    /**
     * Creates a non-blocking result for a classifier failure.
     *
     * @param reason
     *            failure reason code
     * @return fail-open result
     */
    public static ImageModerationResultType failOpen(String reason) {
        return new ImageModerationResultType(false, 0.0, List.of(reason));
    }
}
