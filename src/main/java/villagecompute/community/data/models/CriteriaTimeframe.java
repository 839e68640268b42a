package villagecompute.community.data.models;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Window over which a badge criterion's statistic is measured.
 */
public enum CriteriaTimeframe {

    ALL_TIME(null), DAILY(Duration.ofDays(1)), WEEKLY(Duration.ofDays(7)), MONTHLY(Duration.ofDays(30));

    private final Duration window;

    CriteriaTimeframe(Duration window) {
        this.window = window;
    }

    /**
     * Returns the inclusive start of the window ending at {@code now}, or empty for {@link #ALL_TIME}.
     */
    public Optional<Instant> windowStart(Instant now) {
        return window == null ? Optional.empty() : Optional.of(now.minus(window));
    }
}
