package villagecompute.community.services;

import villagecompute.community.data.models.BadgeCriteriaType;
import villagecompute.community.data.models.CriteriaTimeframe;

import java.util.Map;
import java.util.OptionalLong;

/**
 * Point-in-time user statistics used to evaluate badge criteria.
 *
 * <p>
 * Values are keyed by criterion type and timeframe. A missing entry means the statistic was not computed (custom
 * criteria), and the criterion cannot be satisfied.
 */
public record UserStatsSnapshot(Map<MetricKey, Long> values) {

    public UserStatsSnapshot {
        values = Map.copyOf(values);
    }

    public OptionalLong get(BadgeCriteriaType type, CriteriaTimeframe timeframe) {
        Long value = values.get(new MetricKey(type, timeframe));
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    public record MetricKey(BadgeCriteriaType type, CriteriaTimeframe timeframe) {
    }
}
