package villagecompute.community.services;

/**
 * Issue codes reported by the text rule set, with their severity contribution.
 *
 * <p>
 * A hard issue blocks regardless of the total severity.
 */
public enum ModerationIssue {

    PROFANITY("profanity", 3, false),
    HATE_SPEECH("hate_speech", 5, true),
    SPAM("spam", 3, false),
    INAPPROPRIATE_CONTENT("inappropriate_content", 4, false),
    PERSONAL_INFO("personal_info", 3, false),
    EXCESSIVE_CAPS("excessive_caps", 1, false),
    REPEATED_CHARACTERS("repeated_characters", 1, false);

    private final String code;
    private final int severity;
    private final boolean hard;

    ModerationIssue(String code, int severity, boolean hard) {
        this.code = code;
        this.severity = severity;
        this.hard = hard;
    }

    public String code() {
        return code;
    }

    public int severity() {
        return severity;
    }

    public boolean isHard() {
        return hard;
    }
}
