package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.community.data.models.ContentReport;
import villagecompute.community.data.models.ReportPriority;
import villagecompute.community.data.models.ReportStatus;

import java.util.UUID;

/**
 * Acknowledgement returned to a member who filed a content report.
 */
public record ContentReportResultType(@JsonProperty("report_id") UUID reportId,

        @JsonProperty("status") ReportStatus status,

        @JsonProperty("priority") ReportPriority priority,

        @JsonProperty("estimated_review_time") String estimatedReviewTime) {

    public static ContentReportResultType from(ContentReport report) {
        return new ContentReportResultType(report.id, report.status, report.priority,
                report.priority.estimatedReviewTime());
    }
}
