package com.yerin.flowq.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class FlowQueueMetrics {

    private final MeterRegistry registry;

    private final Counter jobCompleted;
    private final Counter jobRetried;
    private final Counter jobFailed;
    private final Counter jobStalled;
    private final Counter repeatableRemoved;
    private final Counter removalFailures;
    private final Counter jobsMigrated;
    private final Counter migrationAnomalies;
    private final Counter migrationSkipped;
    private final Counter exceptionsReported;

    public FlowQueueMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobCompleted       = Counter.builder("flowq_jobs_completed_total")
                .description("jobs completed").register(registry);
        this.jobRetried         = Counter.builder("flowq_jobs_retried_total")
                .description("jobs scheduled for retry").register(registry);
        this.jobFailed          = Counter.builder("flowq_jobs_failed_total")
                .description("jobs that exhausted their attempts").register(registry);
        this.jobStalled         = Counter.builder("flowq_jobs_stalled_total")
                .description("active jobs whose lease expired").register(registry);
        this.repeatableRemoved  = Counter.builder("flowq_repeatable_removed_total")
                .description("repeat schedules removed").register(registry);
        this.removalFailures    = Counter.builder("flowq_job_removal_failures_total")
                .description("repeat schedules the broker refused to remove").register(registry);
        this.jobsMigrated       = Counter.builder("flowq_jobs_migrated_total")
                .description("scheduled jobs moved to a newer schema version").register(registry);
        this.migrationAnomalies = Counter.builder("flowq_migration_anomalies_total")
                .description("non-repeatable jobs found in the repeatable queue").register(registry);
        this.migrationSkipped   = Counter.builder("flowq_migration_skipped_total")
                .description("migration passes skipped because the lock was not acquired").register(registry);
        this.exceptionsReported = Counter.builder("flowq_exceptions_reported_total")
                .description("exceptions routed to the reporter").register(registry);
    }

    public void incAdded(JobType type) {
        Counter.builder("flowq_jobs_added_total")
                .description("jobs added by type")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    public void incCompleted()          { jobCompleted.increment(); }
    public void incRetried()            { jobRetried.increment(); }
    public void incFailed()             { jobFailed.increment(); }
    public void incStalled(int count)   { jobStalled.increment(count); }
    public void incRepeatableRemoved()  { repeatableRemoved.increment(); }
    public void incRemovalFailure()     { removalFailures.increment(); }
    public void incMigrated(int count)  { jobsMigrated.increment(count); }
    public void incMigrationAnomaly()   { migrationAnomalies.increment(); }
    public void incMigrationSkipped()   { migrationSkipped.increment(); }
    public void incExceptionReported()  { exceptionsReported.increment(); }

    // 큐 이름 태그가 붙은 타이머
    public Timer handlerTimer(String queue) {
        return Timer.builder("flowq_handler_duration_seconds")
                .description("handler duration by queue")
                .tag("queue", queue)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
