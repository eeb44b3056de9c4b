package com.yerin.flowq.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yerin.flowq.domain.BrokerJob;
import com.yerin.flowq.domain.FlowQueueMetrics;
import com.yerin.flowq.domain.JobQueue;
import com.yerin.flowq.domain.data.JobDataSchema;
import com.yerin.flowq.global.exception.ExceptionReporter;
import com.yerin.flowq.global.exception.LockAcquisitionException;
import com.yerin.flowq.infra.lock.LockHandle;
import com.yerin.flowq.infra.lock.LockService;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 예약 큐에 남아 있는 예전 버전 페이로드를 최신 버전까지 올린다.
 * <p>
 * 프로세스 시작마다 한 번, {@value #LOCK_KEY} 락 안에서 실행된다. 각 단계는 끝날 때마다 저장되므로
 * 중간에 죽어도 다음 시작에서 이어서 진행된다. 한 작업의 실패는 나머지 작업에 영향을 주지 않는다.
 */
@Slf4j
public class ScheduledJobMigrator {

    public static final String LOCK_KEY = "jobs_lock";

    private final JobQueue scheduledQueue;
    private final LockService lockService;
    private final ExceptionReporter exceptionReporter;
    private final FlowQueueMetrics metrics;
    private final Duration lockTimeout;
    private final Map<Integer, JobDataMigration> steps = new HashMap<>();

    public ScheduledJobMigrator(JobQueue scheduledQueue,
                                LockService lockService,
                                List<JobDataMigration> steps,
                                ExceptionReporter exceptionReporter,
                                FlowQueueMetrics metrics,
                                Duration lockTimeout) {
        this.scheduledQueue = scheduledQueue;
        this.lockService = lockService;
        this.exceptionReporter = exceptionReporter;
        this.metrics = metrics;
        this.lockTimeout = lockTimeout;
        for (JobDataMigration step : steps) {
            this.steps.put(step.fromVersion(), step);
        }
    }

    public MigrationReport migrate() {
        LockHandle lock;
        try {
            lock = lockService.acquire(LOCK_KEY, lockTimeout);
        } catch (LockAcquisitionException e) {
            log.warn("[Migration] skipped, could not acquire lock key={} within {}ms", LOCK_KEY, lockTimeout.toMillis());
            metrics.incMigrationSkipped();
            return MigrationReport.lockNotAcquired();
        }

        try {
            log.info("[Migration] Starting migration queue={}", scheduledQueue.name());
            List<BrokerJob> jobs = scheduledQueue.getJobs();
            log.info("[Migration] Found {} total jobs", jobs.size());

            int migratedJobs = 0;
            int appliedSteps = 0;
            int failedJobs = 0;
            for (BrokerJob job : jobs) {
                if (!needsMigration(job)) continue;
                try {
                    int applied = migrate(job);
                    if (applied > 0) migratedJobs++;
                    appliedSteps += applied;
                } catch (RuntimeException e) {
                    failedJobs++;
                    exceptionReporter.report(new IllegalStateException(
                            "Failed to migrate job data jobId=" + job.id(), e));
                }
            }

            metrics.incMigrated(migratedJobs);
            log.info("[Migration] Migrated {} jobs ({} steps, {} failed)", migratedJobs, appliedSteps, failedJobs);
            return new MigrationReport(jobs.size(), migratedJobs, appliedSteps, failedJobs, false);
        } finally {
            lockService.release(lock);
        }
    }

    static boolean needsMigration(BrokerJob job) {
        return job != null
                && job.data() != null
                && job.data().isObject()
                && !JobDataSchema.isLatest(job.data());
    }

    /**
     * @return 이 작업에 적용된 단계 수
     */
    private int migrate(BrokerJob job) {
        ObjectNode data = ((ObjectNode) job.data()).deepCopy();
        int version = JobDataSchema.versionOf(data);
        int applied = 0;

        while (version < JobDataSchema.LATEST_VERSION) {
            JobDataMigration step = steps.get(version);
            if (step == null) {
                throw new IllegalStateException("no migration registered from v" + version);
            }
            Optional<ObjectNode> next = step.migrate(job, data);
            if (next.isEmpty()) break;

            data = next.get();
            int migratedVersion = JobDataSchema.versionOf(data);
            if (migratedVersion <= version) {
                throw new IllegalStateException("migration from v" + version + " did not advance the version");
            }
            scheduledQueue.updateData(job.id(), data);
            applied++;
            version = migratedVersion;
        }
        if (applied > 0) {
            log.debug("[Migration] jobId={} now at v{}", job.id(), version);
        }
        return applied;
    }
}
