package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Behaviour summary and 0-10 risk score for one member, with suggested moderator actions.
 */
public record UserRiskAssessmentType(@JsonProperty("user_id") UUID userId,

        @JsonProperty("account_age_days") long accountAgeDays,

        @JsonProperty("posts_last_7_days") long postsLast7Days,

        @JsonProperty("reports_last_7_days") long reportsLast7Days,

        @JsonProperty("reports_last_30_days") long reportsLast30Days,

        @JsonProperty("warnings") long warnings,

        @JsonProperty("risk_score") int riskScore,

        @JsonProperty("recommendations") List<String> recommendations) {

    public UserRiskAssessmentType {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
