package villagecompute.community.observability;

import org.jboss.logging.MDC;

import java.util.UUID;

/**
 * MDC field names and helpers for enriching moderation and scheduler logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code user_id} - Acting user for a submission or admin action</li>
 * <li>{@code content_kind} - Kind of content being submitted</li>
 * <li>{@code job_name} - Scheduler name for maintenance runs</li>
 * </ul>
 *
 * <p>
 * MDC is thread-local; callers remove the fields they set in a {@code finally} block.
 */
public final class LoggingContext {

    public static final String MDC_USER_ID = "user_id";
    public static final String MDC_CONTENT_KIND = "content_kind";
    public static final String MDC_JOB_NAME = "job_name";

    private LoggingContext() {
    }

    public static void setUserId(UUID userId) {
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId.toString());
        }
    }

    public static void setContentKind(Enum<?> kind) {
        if (kind != null) {
            MDC.put(MDC_CONTENT_KIND, kind.name());
        }
    }

    public static void setJobName(String jobName) {
        MDC.put(MDC_JOB_NAME, jobName);
    }

    /**
     * Removes the fields set by {@link #setUserId} and {@link #setContentKind}; {@code job_name} is left alone.
     */
    public static void clearSubmission() {
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_CONTENT_KIND);
    }

    public static void clearJobName() {
        MDC.remove(MDC_JOB_NAME);
    }
}
