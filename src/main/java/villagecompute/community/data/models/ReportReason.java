package villagecompute.community.data.models;

import villagecompute.community.exceptions.ValidationException;

import java.util.Locale;

/**
 * Reasons a member may give when reporting content, with the priority each one starts at.
 */
public enum ReportReason {

    HATE_SPEECH(ReportPriority.HIGH),
    VIOLENCE(ReportPriority.URGENT),
    HARASSMENT(ReportPriority.MEDIUM),
    SPAM(ReportPriority.MEDIUM),
    INAPPROPRIATE_CONTENT(ReportPriority.MEDIUM),
    PERSONAL_INFORMATION(ReportPriority.MEDIUM),
    COPYRIGHT(ReportPriority.MEDIUM),
    MISINFORMATION(ReportPriority.MEDIUM),
    SELF_HARM(ReportPriority.URGENT),
    ILLEGAL_ACTIVITY(ReportPriority.HIGH),
    OTHER(ReportPriority.MEDIUM);

    private final ReportPriority basePriority;

    ReportReason(ReportPriority basePriority) {
        this.basePriority = basePriority;
    }

    public ReportPriority basePriority() {
        return basePriority;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a client-supplied reason such as {@code "hate_speech"}.
     *
     * @throws ValidationException
     *             if the code names no reason
     */
    public static ReportReason fromCode(String code) {
        if (code != null) {
            for (ReportReason reason : values()) {
                if (reason.code().equals(code.trim().toLowerCase(Locale.ROOT))) {
                    return reason;
                }
            }
        }
        throw new ValidationException("Invalid report reason");
    }
}
