package etlflow.engine.scheduler;

import etlflow.engine.model.Job;
import etlflow.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether a job's schedule says it should run now.
 * When a job is not due, its projected next run is stored for display.
 */
public class DueEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DueEvaluator.class);

    private final JobRepository jobRepository;
    private final Clock clock;
    private final Duration cronDebounce;

    public DueEvaluator(JobRepository jobRepository, Clock clock, Duration cronDebounce) {
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.cronDebounce = cronDebounce;
    }

    public boolean isDue(Job job) {
        Instant now = clock.instant();
        return switch (job.scheduleKind()) {
            case MANUAL -> false;
            case INTERVAL -> intervalDue(job, now);
            case CRON -> cronDue(job, now);
        };
    }

    private boolean intervalDue(Job job, Instant now) {
        Integer minutes = job.intervalMinutes();
        if (minutes == null || minutes <= 0) {
            log.warn("Job {} has no valid interval, skipped", job.name());
            return false;
        }
        if (job.lastRun() == null) {
            return true;
        }

        Instant due = job.lastRun().plus(Duration.ofMinutes(minutes));
        if (!now.isBefore(due)) {
            return true;
        }
        if (job.nextRun() == null) {
            jobRepository.updateNextRun(job.id(), due);
        }
        return false;
    }

    private boolean cronDue(Job job, Instant now) {
        CronSchedule schedule;
        try {
            schedule = CronSchedule.parse(job.cronExpression());
        } catch (IllegalArgumentException e) {
            log.warn("Job {} has an invalid cron expression '{}': {}", job.name(), job.cronExpression(),
                    e.getMessage());
            return false;
        }

        Instant lastRun = job.lastRun();
        if (lastRun == null) {
            return true;
        }

        // Debounce keeps a job from firing twice inside one matching minute
        Instant occurrence = schedule.nextAfter(lastRun);
        boolean debounced = Duration.between(lastRun, now).compareTo(cronDebounce) > 0;
        if (occurrence != null && !occurrence.isAfter(now) && debounced) {
            return true;
        }

        Instant next = schedule.nextAtOrAfter(now);
        if (next != null && !Objects.equals(next, job.nextRun())) {
            jobRepository.updateNextRun(job.id(), next);
        }
        return false;
    }
}
