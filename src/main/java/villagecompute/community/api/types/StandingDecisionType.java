package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Whether a user may currently submit content.
 *
 * <p>
 * When {@code allowed} is false, {@code kind}, {@code reason} and {@code issuedAt} describe the sanction that
 * applies; {@code expiresAt} is only set for suspensions.
 */
public record StandingDecisionType(@JsonProperty("allowed") boolean allowed,

        @JsonProperty("kind") StandingKind kind,

        @JsonProperty("reason") String reason,

        @JsonProperty("issued_at") Instant issuedAt,

        @JsonProperty("expires_at") Instant expiresAt) {

    private static final StandingDecisionType ALLOW = new StandingDecisionType(true, null, null, null, null);

    public static StandingDecisionType allow() {
        return ALLOW;
    }

    public static StandingDecisionType banned(String reason, Instant issuedAt) {
        return new StandingDecisionType(false, StandingKind.BAN, reason, issuedAt, null);
    }

    public static StandingDecisionType suspended(String reason, Instant issuedAt, Instant expiresAt) {
        return new StandingDecisionType(false, StandingKind.SUSPENSION, reason, issuedAt, expiresAt);
    }
}
