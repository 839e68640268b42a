package villagecompute.community.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.community.observability.LoggingContext;
import villagecompute.community.services.StreakService;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Scheduler that resets login streaks broken by a missed day.
 *
 * <p>
 * <b>Schedule:</b> daily shortly after midnight UTC ({@code community.jobs.streak-reset.cron})
 */
@ApplicationScoped
public class StreakResetScheduler {

    private static final Logger LOG = Logger.getLogger(StreakResetScheduler.class);

    @Inject
    StreakService streakService;

    Clock clock = Clock.systemUTC();

    @Scheduled(
            cron = "{community.jobs.streak-reset.cron}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void resetBrokenStreaks() {
        LoggingContext.setJobName("streak-reset");
        try {
            int count = streakService.resetBrokenLoginStreaks(LocalDate.now(clock.withZone(ZoneOffset.UTC)));
            LOG.infof("Streak reset run complete: %d login streaks reset", count);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Streak reset run failed");
        } finally {
            LoggingContext.clearJobName();
        }
    }
}
