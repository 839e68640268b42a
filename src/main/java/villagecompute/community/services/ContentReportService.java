package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.community.api.types.ContentReportResultType;
import villagecompute.community.api.types.ModerationVerdictType;
import villagecompute.community.data.models.ContentReport;
import villagecompute.community.data.models.ReportPriority;
import villagecompute.community.data.models.ReportReason;
import villagecompute.community.data.models.ReportStatus;
import villagecompute.community.data.models.ReportTarget;
import villagecompute.community.data.repositories.ContentReportRepository;
import villagecompute.community.data.repositories.UserRepository;
import villagecompute.community.exceptions.DuplicateResourceException;
import villagecompute.community.exceptions.RateLimitException;
import villagecompute.community.exceptions.ResourceNotFoundException;
import villagecompute.community.exceptions.ValidationException;
import villagecompute.community.integration.webhooks.WebhookDispatcher;
import villagecompute.community.observability.CommunityMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Member reports against content and other members, and their moderator outcome.
 *
 * <p>
 * <b>Filing a report:</b>
 * <ol>
 * <li>Reason must be one of {@link ReportReason}</li>
 * <li>Reported content (or user) must exist</li>
 * <li>Members cannot report their own content or themselves</li>
 * <li>One live report per reporter and target; a dismissed report may be filed again</li>
 * <li>At most {@value #REPORTS_PER_HOUR} reports per reporter in any trailing hour</li>
 * <li>Reported text is run through the text filter; its verdict raises the priority</li>
 * </ol>
 *
 * <p>
 * Priority starts from the reason ({@link ReportReason#basePriority()}) and is raised to
 * {@link ReportPriority#HIGH} when the reported text would be blocked.
 */
@ApplicationScoped
public class ContentReportService {

    private static final Logger LOG = Logger.getLogger(ContentReportService.class);

    static final int REPORTS_PER_HOUR = 10;

    private static final Comparator<ContentReport> QUEUE_ORDER = Comparator
            .comparing((ContentReport r) -> r.priority, Comparator.reverseOrder())
            .thenComparing(r -> r.createdAt);

    @Inject
    ContentReportRepository reportRepository;

    @Inject
    UserRepository userRepository;

    @Inject
    TextModerationService textModerationService;

    @Inject
    CommunityMetrics metrics;

    @Inject
    WebhookDispatcher webhookDispatcher;

    Clock clock = Clock.systemUTC();

    /**
     * Files a report.
     *
     * @param lookup
     *            resolves post, comment and message targets
     * @param reasonCode
     *            client reason code such as {@code "harassment"}
     * @param description
     *            optional note from the reporter
     * @throws ValidationException
     *             for an unknown reason or a self-report
     * @throws ResourceNotFoundException
     *             if the target does not exist
     * @throws DuplicateResourceException
     *             if the reporter already has a live report on the target
     * @throws RateLimitException
     *             if the reporter filed {@value #REPORTS_PER_HOUR} reports in the last hour
     */
    @Transactional
    public ContentReportResultType reportContent(UUID reporterId, ReportTarget targetType, UUID targetId,
            String reasonCode, String description, ContentLookup lookup) {
        ReportReason reason = ReportReason.fromCode(reasonCode);
        if (targetType == null || targetId == null) {
            throw new ValidationException("Report target is required");
        }

        ReportedContent content = findTarget(targetType, targetId, lookup);
        if (content.authorId().equals(reporterId)) {
            throw new ValidationException("You cannot report your own content");
        }
        if (reportRepository.hasLiveReport(reporterId, targetType, targetId)) {
            throw new DuplicateResourceException("You have already reported this content");
        }

        Instant now = clock.instant();
        if (reportRepository.countByReporterSince(reporterId, now.minus(Duration.ofHours(1))) >= REPORTS_PER_HOUR) {
            throw new RateLimitException("Too many reports in the last hour. Please wait before reporting again.");
        }

        ModerationVerdictType verdict = targetType == ReportTarget.USER ? ModerationVerdictType.clean("")
                : textModerationService.evaluate(content.text());

        ContentReport report = new ContentReport();
        report.reporterId = reporterId;
        report.targetType = targetType;
        report.targetId = targetId;
        report.reportedUserId = content.authorId();
        report.reason = reason;
        report.description = sanitizeDescription(description);
        report.status = ReportStatus.PENDING;
        report.priority = priority(reason, verdict);
        report.severity = verdict.severity();
        report.issues = verdict.issues();
        report.createdAt = now;
        report.updatedAt = now;
        reportRepository.persist(report);

        LOG.infof("Report %s filed by %s against %s %s: reason=%s, priority=%s", report.id, reporterId, targetType,
                targetId, reason, report.priority);
        metrics.incrementContentReport(reason.code(), report.priority.name());

        Map<String, Object> payload = new HashMap<>();
        payload.put("reportId", String.valueOf(report.id));
        payload.put("targetType", targetType.name());
        payload.put("targetId", targetId.toString());
        payload.put("reportedUserId", content.authorId().toString());
        payload.put("reason", reason.code());
        payload.put("priority", report.priority.name());
        webhookDispatcher.dispatch(WebhookDispatcher.EVENT_CONTENT_REPORTED, payload);

        return ContentReportResultType.from(report);
    }

    /**
     * Open reports, highest priority first and oldest first within a priority.
     */
    public List<ContentReport> findOpen(int limit) {
        return reportRepository.findOpen().stream().sorted(QUEUE_ORDER).limit(Math.max(limit, 0)).toList();
    }

    @Transactional
    public ContentReport startReview(UUID reportId, UUID moderatorId) {
        ContentReport report = findOpenReport(reportId);
        report.status = ReportStatus.REVIEWING;
        report.updatedAt = clock.instant();
        reportRepository.persist(report);
        LOG.infof("Moderator %s started review of report %s", moderatorId, reportId);
        return report;
    }

    /**
     * Closes a report after action was taken.
     *
     * @param actionTaken
     *            short description of the sanction or edit, e.g. {@code "content_removed"}
     */
    @Transactional
    public ContentReport resolve(UUID reportId, UUID moderatorId, String resolution, String actionTaken) {
        return close(reportId, moderatorId, ReportStatus.RESOLVED, resolution, actionTaken);
    }

    /**
     * Closes a report without action. The reporter may report the same target again afterwards.
     */
    @Transactional
    public ContentReport dismiss(UUID reportId, UUID moderatorId, String resolution) {
        return close(reportId, moderatorId, ReportStatus.DISMISSED, resolution, null);
    }

    static ReportPriority priority(ReportReason reason, ModerationVerdictType verdict) {
        ReportPriority priority = reason.basePriority();
        if (verdict.shouldBlock()) {
            priority = priority.atLeast(ReportPriority.HIGH);
        }
        return priority;
    }

    String sanitizeDescription(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        String cleaned = textModerationService.removePersonalInfo(description.trim());
        return cleaned.length() > ContentReport.MAX_DESCRIPTION_LENGTH
                ? cleaned.substring(0, ContentReport.MAX_DESCRIPTION_LENGTH)
                : cleaned;
    }

    private ReportedContent findTarget(ReportTarget targetType, UUID targetId, ContentLookup lookup) {
        if (targetType == ReportTarget.USER) {
            return userRepository.findByIdOptional(targetId).map(user -> new ReportedContent(user.id, null))
                    .orElseThrow(() -> new ResourceNotFoundException("User not found: " + targetId));
        }
        return lookup.find(targetType, targetId).orElseThrow(
                () -> new ResourceNotFoundException("Reported content not found: " + targetType + " " + targetId));
    }

    private ContentReport close(UUID reportId, UUID moderatorId, ReportStatus status, String resolution,
            String actionTaken) {
        ContentReport report = findOpenReport(reportId);
        report.close(status, moderatorId, resolution, actionTaken, clock.instant());
        reportRepository.persist(report);
        LOG.infof("Moderator %s closed report %s as %s", moderatorId, reportId, status);
        return report;
    }

    private ContentReport findOpenReport(UUID reportId) {
        ContentReport report = reportRepository.findByIdOptional(reportId)
                .orElseThrow(() -> new ResourceNotFoundException("Report not found: " + reportId));
        if (!report.status.isOpen()) {
            throw new ValidationException("Report is already " + report.status.name().toLowerCase(Locale.ROOT));
        }
        return report;
    }
}
