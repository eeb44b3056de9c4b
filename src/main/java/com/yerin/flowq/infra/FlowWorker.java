package com.yerin.flowq.infra;

import com.yerin.flowq.application.FlowJobHandler;
import com.yerin.flowq.application.FlowJobHandlerRegistry;
import com.yerin.flowq.application.FlowRunHooks;
import com.yerin.flowq.application.FlowWorkerHooks;
import com.yerin.flowq.domain.BrokerJob;
import com.yerin.flowq.domain.FailureOutcome;
import com.yerin.flowq.domain.FlowQueueMetrics;
import com.yerin.flowq.domain.JobQueue;
import com.yerin.flowq.global.exception.ExceptionReporter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 두 큐를 번갈아 폴링하며 작업을 실행한다.
 * 성공하면 complete, 실패하면 지수 백오프로 재시도를 예약하고 시도 횟수를 다 쓰면 failed 로 보낸다.
 */
@Slf4j
public class FlowWorker {

    private final List<JobQueue> queues;
    private final FlowJobHandlerRegistry registry;
    private final FlowWorkerHooks workerHooks;
    private final FlowRunHooks runHooks;
    private final ExceptionReporter exceptionReporter;
    private final FlowQueueMetrics metrics;
    private final Clock clock;

    private final int concurrency;
    private final Duration lease;
    private final long pollMillis;

    private ExecutorService workers;

    public FlowWorker(List<JobQueue> queues,
                      FlowJobHandlerRegistry registry,
                      FlowWorkerHooks workerHooks,
                      FlowRunHooks runHooks,
                      ExceptionReporter exceptionReporter,
                      FlowQueueMetrics metrics,
                      Clock clock,
                      int concurrency,
                      Duration lease,
                      long pollMillis) {
        this.queues = queues;
        this.registry = registry;
        this.workerHooks = workerHooks;
        this.runHooks = runHooks;
        this.exceptionReporter = exceptionReporter;
        this.metrics = metrics;
        this.clock = clock;
        this.concurrency = concurrency;
        this.lease = lease;
        this.pollMillis = pollMillis;
    }

    public synchronized void start() {
        if (workers != null) return;

        workers = Executors.newFixedThreadPool(concurrency);
        for (int i = 0; i < concurrency; i++) {
            workers.submit(() -> {
                while (!Thread.currentThread().isInterrupted()) {
                    try {
                        boolean processed = false;
                        for (JobQueue queue : queues) {
                            processed |= pollOnce(queue);
                        }
                        if (!processed) Thread.sleep(pollMillis);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    } catch (Exception e) {
                        log.warn("[Worker] poll loop error: {}", e.toString());
                        try { Thread.sleep(pollMillis); } catch (InterruptedException ignored) {
                            Thread.currentThread().interrupt();
                        }
                    }
                }
            });
        }
        log.info("[Worker] started {} consumers on {} (process={})",
                concurrency, queues.stream().map(JobQueue::name).toList(), WorkerId.processName());
    }

    @PreDestroy
    public synchronized void stop() {
        if (workers != null) {
            workers.shutdownNow();
            workers = null;
        }
    }

    /**
     * @return 작업을 하나 꺼내 처리했으면 true
     */
    public boolean pollOnce(JobQueue queue) {
        Optional<BrokerJob> next = queue.moveToActive(clock.instant(), lease);
        if (next.isEmpty()) return false;
        process(queue, next.get());
        return true;
    }

    private void process(JobQueue queue, BrokerJob job) {
        String projectId = job.data().path("projectId").asText(null);
        String runId = job.data().path("runId").asText(job.id());

        if (!preExecute(projectId, runId)) {
            queue.complete(job, clock.instant());
            log.info("[Worker] skipped by preExecute queue={}, jobId={}, projectId={}", queue.name(), job.id(), projectId);
            return;
        }

        try {
            runHooks.onPreStart(projectId);
        } catch (RuntimeException e) {
            exceptionReporter.report(e);
        }

        int taskCount;
        try {
            taskCount = runHandler(queue, job);
        } catch (Exception ex) {
            handleFailure(queue, job, ex);
            return;
        }

        if (queue.complete(job, clock.instant())) {
            metrics.incCompleted();
            log.info("[Worker] completed queue={}, jobId={}, tasks={}", queue.name(), job.id(), taskCount);
        } else {
            log.warn("[Worker] complete lost race queue={}, jobId={}", queue.name(), job.id());
        }

        try {
            runHooks.onFinish(projectId, taskCount);
        } catch (RuntimeException e) {
            exceptionReporter.report(e);
        }
    }

    private boolean preExecute(String projectId, String runId) {
        try {
            return workerHooks.preExecute(projectId, runId);
        } catch (RuntimeException e) {
            // 훅 오류로 실행을 막지 않는다
            exceptionReporter.report(e);
            return true;
        }
    }

    private int runHandler(JobQueue queue, BrokerJob job) {
        long start = System.nanoTime();
        try {
            FlowJobHandler handler = registry.get(queue.name());
            if (handler == null) throw new IllegalStateException("No handler for queue=" + queue.name());
            return handler.handle(job);
        } finally {
            metrics.handlerTimer(queue.name()).record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private void handleFailure(JobQueue queue, BrokerJob job, Exception ex) {
        Instant now = clock.instant();
        Duration wait = Backoff.of(job.opts() == null ? null : job.opts().backoff(), job.attemptsMade() + 1);
        FailureOutcome outcome = queue.fail(job, ex.toString(), now.plus(wait), now);

        if (outcome == FailureOutcome.RETRY_SCHEDULED) {
            metrics.incRetried();
            log.info("[Worker] reserved retry queue={}, jobId={} after {} ms, err={}",
                    queue.name(), job.id(), wait.toMillis(), ex.toString());
        } else if (outcome == FailureOutcome.FAILED) {
            metrics.incFailed();
            log.warn("[Worker] failed queue={}, jobId={}, attempts={}, err={}",
                    queue.name(), job.id(), job.attemptsMade() + 1, ex.toString());
        } else {
            log.warn("[Worker] fail lost race queue={}, jobId={}", queue.name(), job.id());
        }
    }
}
