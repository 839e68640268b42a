package villagecompute.community.data.models;

/**
 * Lifecycle of a content report. {@link #RESOLVED} and {@link #DISMISSED} are terminal.
 */
public enum ReportStatus {

    PENDING, REVIEWING, RESOLVED, DISMISSED;

    public boolean isOpen() {
        return this == PENDING || this == REVIEWING;
    }
}
