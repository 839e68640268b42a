package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.community.data.models.StreakType;

/**
 * Streak state after recording an activity, plus the milestone reached by this activity if any.
 */
public record StreakUpdateType(@JsonProperty("streak_type") StreakType streakType,

        @JsonProperty("current") int current,

        @JsonProperty("longest") int longest,

        @JsonProperty("advanced") boolean advanced,

        @JsonProperty("milestone_title") String milestoneTitle,

        @JsonProperty("milestone_points") int milestonePoints) {

    public boolean reachedMilestone() {
        return milestoneTitle != null;
    }
}
