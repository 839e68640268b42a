package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of scanning a piece of text against the moderation rule set.
 *
 * <p>
 * {@code shouldBlock} and {@code shouldFlag} are never both true. When neither is set, {@code cleanedContent} is
 * the input verbatim.
 */
public record ModerationVerdictType(@JsonProperty("should_block") boolean shouldBlock,

        @JsonProperty("should_flag") boolean shouldFlag,

        @JsonProperty("severity") int severity,

        @JsonProperty("issues") List<String> issues,

        @JsonProperty("cleaned_content") String cleanedContent) {

    public ModerationVerdictType {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Creates a verdict for text that triggered no rule.
     *
     * @param content
     *            the scanned text, returned unchanged (null becomes empty)
     * @return clean verdict
     */
    public static ModerationVerdictType clean(String content) {
        return new ModerationVerdictType(false, false, 0, List.of(), content == null ? "" : content);
    }

    public boolean isClean() {
        return !shouldBlock && !shouldFlag;
    }
}
