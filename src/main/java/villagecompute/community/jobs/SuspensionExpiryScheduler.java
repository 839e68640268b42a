package villagecompute.community.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.community.observability.LoggingContext;
import villagecompute.community.services.UserStandingService;

import java.time.Clock;

/**
 * Scheduler that deactivates elapsed suspensions.
 *
 * <p>
 * Standing checks already ignore expired suspensions; this job keeps {@code is_active} accurate for admin views and
 * reporting.
 *
 * <p>
 * <b>Schedule:</b> hourly at the top of the hour ({@code community.jobs.suspension-expiry.cron})
 */
@ApplicationScoped
public class SuspensionExpiryScheduler {

    private static final Logger LOG = Logger.getLogger(SuspensionExpiryScheduler.class);

    @Inject
    UserStandingService standingService;

    Clock clock = Clock.systemUTC();

    @Scheduled(
            cron = "{community.jobs.suspension-expiry.cron}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void deactivateExpiredSuspensions() {
        LoggingContext.setJobName("suspension-expiry");
        try {
            int count = standingService.deactivateExpiredSuspensions(clock.instant());
            LOG.infof("Suspension expiry run complete: %d deactivated", count);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Suspension expiry run failed");
        } finally {
            LoggingContext.clearJobName();
        }
    }
}
