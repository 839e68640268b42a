package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.community.data.models.ContentReport;
import villagecompute.community.data.models.ReportStatus;
import villagecompute.community.data.models.ReportTarget;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class ContentReportRepository implements PanacheRepositoryBase<ContentReport, UUID> {

    /**
     * True when the reporter already has a report on this target that was not dismissed.
     */
    public boolean hasLiveReport(UUID reporterId, ReportTarget targetType, UUID targetId) {
        return count("reporterId = ?1 AND targetType = ?2 AND targetId = ?3 AND status <> ?4", reporterId, targetType,
                targetId, ReportStatus.DISMISSED) > 0;
    }

    public long countByReporterSince(UUID reporterId, Instant since) {
        return count("reporterId = ?1 AND createdAt >= ?2", reporterId, since);
    }

    public long countAgainstUserSince(UUID reportedUserId, Instant since) {
        return count("reportedUserId = ?1 AND createdAt >= ?2", reportedUserId, since);
    }

    /**
     * Pending and in-review reports, oldest first.
     */
    public List<ContentReport> findOpen() {
        return list("status IN ?1 ORDER BY createdAt ASC", List.of(ReportStatus.PENDING, ReportStatus.REVIEWING));
    }
}
