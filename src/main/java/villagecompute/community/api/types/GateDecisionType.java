package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.community.data.models.ContentKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Decision of the moderation gate for one submission.
 *
 * <p>
 * Blocked content must not be persisted. Flagged content is persisted as {@code cleanedContent} and queued for
 * admin review.
 */
public record GateDecisionType(@JsonProperty("kind") ContentKind kind,

        @JsonProperty("should_block") boolean shouldBlock,

        @JsonProperty("should_flag") boolean shouldFlag,

        @JsonProperty("cleaned_content") String cleanedContent,

        @JsonProperty("issues") List<String> issues,

        @JsonProperty("severity") int severity) {

    public GateDecisionType {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static GateDecisionType fromVerdict(ContentKind kind, ModerationVerdictType verdict) {
        return new GateDecisionType(kind, verdict.shouldBlock(), verdict.shouldFlag(), verdict.cleanedContent(),
                verdict.issues(), verdict.severity());
    }

    /**
     * Returns a blocking copy of this decision with {@code issue} appended.
     */
    public GateDecisionType block(String issue) {
        List<String> combined = new ArrayList<>(issues);
        if (!combined.contains(issue)) {
            combined.add(issue);
        }
        return new GateDecisionType(kind, true, false, cleanedContent, combined, severity);
    }

    /**
     * Short label used for metrics and logs: {@code blocked}, {@code flagged} or {@code allowed}.
     */
    public String outcome() {
        if (shouldBlock) {
            return "blocked";
        }
        return shouldFlag ? "flagged" : "allowed";
    }
}
