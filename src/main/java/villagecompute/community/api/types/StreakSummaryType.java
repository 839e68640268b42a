package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.community.data.models.StreakType;

import java.time.LocalDate;

/**
 * Current and longest streak of one type. A type with no recorded activity reports zeros.
 */
public record StreakSummaryType(@JsonProperty("type") StreakType type,

        @JsonProperty("current") int current,

        @JsonProperty("longest") int longest,

        @JsonProperty("last_activity_date") LocalDate lastActivityDate) {

    public static StreakSummaryType empty(StreakType type) {
        return new StreakSummaryType(type, 0, 0, null);
    }
}
