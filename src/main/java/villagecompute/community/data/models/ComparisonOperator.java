package villagecompute.community.data.models;

/**
 * Comparison applied between a user statistic and a badge criterion's target value. Persisted by name.
 */
public enum ComparisonOperator {

    GREATER_OR_EQUAL, GREATER, EQUAL, LESS, LESS_OR_EQUAL;

    /**
     * Evaluates {@code actual <op> target}.
     *
     * @param actual
     *            the user's statistic
     * @param target
     *            the criterion value
     * @return true when the comparison holds
     */
    public boolean test(long actual, long target) {
        return switch (this) {
            case GREATER_OR_EQUAL -> actual >= target;
            case GREATER -> actual > target;
            case EQUAL -> actual == target;
            case LESS -> actual < target;
            case LESS_OR_EQUAL -> actual <= target;
        };
    }
}
