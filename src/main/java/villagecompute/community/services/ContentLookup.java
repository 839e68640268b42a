package villagecompute.community.services;

import villagecompute.community.data.models.ReportTarget;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves reported content on behalf of {@link ContentReportService}.
 *
 * <p>
 * Implemented by the owning feature, like {@link ContentWriter}. Never called for {@link ReportTarget#USER}.
 */
@FunctionalInterface
public interface ContentLookup {

    /**
     * @return the content, or empty when it does not exist
     */
    Optional<ReportedContent> find(ReportTarget type, UUID targetId);
}
