package villagecompute.community.data.models;

/**
 * Review priority of a content report, lowest first.
 */
public enum ReportPriority {

    LOW("< 72 hours"), MEDIUM("< 72 hours"), HIGH("< 24 hours"), URGENT("< 1 hour");

    private final String estimatedReviewTime;

    ReportPriority(String estimatedReviewTime) {
        this.estimatedReviewTime = estimatedReviewTime;
    }

    /**
     * Review time promised to the reporter.
     */
    public String estimatedReviewTime() {
        return estimatedReviewTime;
    }

    public ReportPriority atLeast(ReportPriority floor) {
        return compareTo(floor) >= 0 ? this : floor;
    }
}
