package com.yerin.flowq.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.flowq.application.FlowJobHandler;
import com.yerin.flowq.application.FlowJobHandlerRegistry;
import com.yerin.flowq.application.FlowRunHooks;
import com.yerin.flowq.application.FlowWorkerHooks;
import com.yerin.flowq.domain.BrokerJob;
import com.yerin.flowq.domain.FlowQueueMetrics;
import com.yerin.flowq.domain.JobOptions;
import com.yerin.flowq.global.exception.ExceptionReporter;
import com.yerin.flowq.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("워커 실행/재시도/훅 테스트")
public class FlowWorkerTest {

    private static final String QUEUE = "oneTimeJobs";

    private final ObjectMapper om = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final InMemoryJobQueue queue = new InMemoryJobQueue(QUEUE, clock);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final FlowQueueMetrics metrics = new FlowQueueMetrics(registry);
    private final ExceptionReporter reporter = mock(ExceptionReporter.class);
    private final FlowRunHooks runHooks = mock(FlowRunHooks.class);

    private final AtomicInteger calls = new AtomicInteger();

    private FlowJobHandler handler(boolean fail) {
        return new FlowJobHandler() {
            @Override
            public String queue() {
                return QUEUE;
            }

            @Override
            public int handle(BrokerJob job) {
                calls.incrementAndGet();
                if (fail) throw new IllegalStateException("engine unavailable");
                return 3;
            }
        };
    }

    private FlowWorker worker(FlowJobHandler handler, FlowWorkerHooks hooks) {
        return new FlowWorker(List.of(queue), new FlowJobHandlerRegistry(List.of(handler)), hooks, runHooks,
                reporter, metrics, clock, 1, Duration.ofSeconds(30), 10);
    }

    private void addRun(String runId) {
        queue.add(runId, om.createObjectNode().put("runId", runId).put("projectId", "p-1"),
                JobOptions.defaults(5, Duration.ofMinutes(8).toMillis()).toBuilder().jobId(runId).priority(2).build());
    }

    @Test
    @DisplayName("성공하면 작업이 제거되고 훅이 호출된다")
    void completes_and_calls_hooks() {
        addRun("run-1");
        FlowWorker sut = worker(handler(false), new FlowWorkerHooks() {});

        assertThat(sut.pollOnce(queue)).isTrue();

        assertThat(queue.getJob("run-1")).isEmpty();
        assertThat(queue.counts().active()).isZero();
        verify(runHooks).onPreStart("p-1");
        verify(runHooks).onFinish("p-1", 3);
        assertThat(registry.find("flowq_jobs_completed_total").counter().count()).isEqualTo(1.0);
        assertThat(sut.pollOnce(queue)).isFalse();
    }

    @Test
    @DisplayName("실패하면 8, 16, 32, 64분 뒤 재시도하고 5번째 실패 후 failed 로 간다")
    void retries_with_exponential_backoff_then_fails() {
        addRun("run-1");
        FlowWorker sut = worker(handler(true), new FlowWorkerHooks() {});

        for (long minutes : new long[]{8, 16, 32, 64}) {
            sut.pollOnce(queue);

            Instant failedAt = clock.instant();
            assertThat(queue.promoteDelayed(failedAt.plus(Duration.ofMinutes(minutes)).minusMillis(1))).isZero();
            clock.advance(Duration.ofMinutes(minutes));
            assertThat(queue.promoteDelayed(clock.instant())).isEqualTo(1);
        }
        sut.pollOnce(queue);

        assertThat(calls.get()).isEqualTo(5);
        assertThat(queue.counts().failed()).isEqualTo(1);
        assertThat(queue.counts().delayed()).isZero();
        assertThat(queue.getJob("run-1").orElseThrow().failedReason()).contains("engine unavailable");
        assertThat(registry.find("flowq_jobs_retried_total").counter().count()).isEqualTo(4.0);
        assertThat(registry.find("flowq_jobs_failed_total").counter().count()).isEqualTo(1.0);
        verify(runHooks, never()).onFinish(anyString(), anyInt());
    }

    @Test
    @DisplayName("preExecute 가 false 면 실행하지 않고 완료 처리한다")
    void quota_veto_completes_without_running() {
        addRun("run-1");
        FlowWorker sut = worker(handler(false), new FlowWorkerHooks() {
            @Override
            public boolean preExecute(String projectId, String runId) {
                return false;
            }
        });

        sut.pollOnce(queue);

        assertThat(calls.get()).isZero();
        assertThat(queue.getJob("run-1")).isEmpty();
        verifyNoInteractions(runHooks);
    }

    @Test
    @DisplayName("훅 예외는 보고만 하고 실행은 계속된다")
    void hook_failure_does_not_block_execution() {
        addRun("run-1");
        doThrow(new IllegalStateException("hook down")).when(runHooks).onPreStart(any());
        FlowWorker sut = worker(handler(false), new FlowWorkerHooks() {
            @Override
            public boolean preExecute(String projectId, String runId) {
                throw new IllegalStateException("quota service down");
            }
        });

        sut.pollOnce(queue);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(queue.getJob("run-1")).isEmpty();
        verify(reporter, times(2)).report(any(IllegalStateException.class));
    }

    @Test
    @DisplayName("핸들러가 없는 큐의 작업은 실패로 처리된다")
    void missing_handler_fails_job() {
        addRun("run-1");
        FlowWorker sut = new FlowWorker(List.of(queue), new FlowJobHandlerRegistry(List.of()),
                new FlowWorkerHooks() {}, runHooks, reporter, metrics, clock, 1, Duration.ofSeconds(30), 10);

        sut.pollOnce(queue);

        assertThat(queue.counts().delayed()).isEqualTo(1);
        assertThat(queue.getJob("run-1").orElseThrow().attemptsMade()).isEqualTo(1);
    }

    @Test
    @DisplayName("lease 가 지난 작업은 reaper 가 wait 로 되돌리고, promoter 는 실행 시각이 된 작업을 올린다")
    void reaper_and_promoter() {
        addRun("run-1");
        queue.moveToActive(clock.instant(), Duration.ofSeconds(30));
        queue.add("later", om.createObjectNode().put("runId", "later"),
                JobOptions.builder().jobId("later").delay(10_000L).build());

        clock.advance(Duration.ofSeconds(31));
        new StalledJobReaper(List.of(queue), metrics, clock).reap();
        new DelayedJobPromoter(List.of(queue), clock).promoteDue();

        assertThat(queue.counts().waiting()).isEqualTo(2);
        assertThat(queue.counts().active()).isZero();
        assertThat(registry.find("flowq_jobs_stalled_total").counter().count()).isEqualTo(1.0);
    }
}
