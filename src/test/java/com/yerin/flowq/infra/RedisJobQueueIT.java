package com.yerin.flowq.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yerin.flowq.domain.*;
import com.yerin.flowq.global.exception.ExceptionReporter;
import com.yerin.flowq.infra.lock.InMemoryLockService;
import com.yerin.flowq.migration.*;
import com.yerin.flowq.service.FlowScheduleService;
import com.yerin.flowq.support.IntegrationTestBase;
import com.yerin.flowq.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Redis 브로커 큐 통합 테스트")
public class RedisJobQueueIT extends IntegrationTestBase {

    private static final Duration LEASE = Duration.ofSeconds(30);

    @Autowired
    StringRedisTemplate redis;

    @Autowired
    ObjectMapper om;

    private final ExceptionReporter reporter = mock(ExceptionReporter.class);

    private MutableClock clock;
    private RedisJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:01:30Z"));
        queue = new RedisJobQueue("itJobs", "flowq-it-" + UUID.randomUUID(), redis, om, reporter, clock);
    }

    private ObjectNode data(String id) {
        return om.createObjectNode().put("flowVersionId", id).put("projectId", "p-1");
    }

    @Test
    @DisplayName("HIGH 우선순위가 먼저, 같은 우선순위는 넣은 순서대로")
    void priority_then_fifo() {
        queue.add("n1", data("n1"), JobOptions.builder().jobId("n1").priority(2).build());
        queue.add("h1", data("h1"), JobOptions.builder().jobId("h1").priority(1).build());
        queue.add("n2", data("n2"), JobOptions.builder().jobId("n2").priority(2).build());
        queue.add("n1", data("dup"), JobOptions.builder().jobId("n1").priority(1).build());

        Instant now = clock.instant();
        assertThat(queue.moveToActive(now, LEASE)).get().extracting(BrokerJob::id).isEqualTo("h1");
        assertThat(queue.moveToActive(now, LEASE)).get().extracting(BrokerJob::id).isEqualTo("n1");
        assertThat(queue.moveToActive(now, LEASE)).get().extracting(BrokerJob::id).isEqualTo("n2");
        assertThat(queue.moveToActive(now, LEASE)).isEmpty();
        assertThat(queue.getJob("n1").orElseThrow().data().path("flowVersionId").asText()).isEqualTo("n1");
    }

    @Test
    @DisplayName("지연 작업은 실행 시각 이후에만 wait 로 올라간다")
    void delayed_promotion() {
        queue.add("run-42", data("run-42"), JobOptions.builder().jobId("run-42").delay(5000L).build());

        assertThat(queue.promoteDelayed(clock.instant().plusMillis(4999))).isZero();
        assertThat(queue.promoteDelayed(clock.instant().plusMillis(5000))).isEqualTo(1);
        assertThat(queue.promoteDelayed(clock.instant().plusMillis(6000))).isZero();
        assertThat(queue.counts().waiting()).isEqualTo(1);
    }

    @Test
    @DisplayName("반복 스케줄은 한 번만 등록되고, 실행되면 다음 실행분이 예약된다")
    void repeat_schedule_lifecycle() {
        var opts = JobOptions.builder().jobId("fv-1").repeat(new RepeatOptions("*/5 * * * *", "UTC")).build();

        BrokerJob first = queue.add("fv-1", data("fv-1"), opts);
        BrokerJob again = queue.add("fv-1", data("fv-1"), opts);

        assertThat(again.id()).isEqualTo(first.id());
        assertThat(first.repeatJobKey()).isEqualTo("fv-1:fv-1::UTC:*/5 * * * *");
        assertThat(queue.getRepeatableJobs()).singleElement()
                .satisfies(r -> {
                    assertThat(r.pattern()).isEqualTo("*/5 * * * *");
                    assertThat(r.tz()).isEqualTo("UTC");
                    assertThat(r.next()).isEqualTo(Instant.parse("2024-01-01T00:05:00Z").toEpochMilli());
                });

        clock.advance(Duration.ofMinutes(4));
        queue.promoteDelayed(clock.instant());
        BrokerJob active = queue.moveToActive(clock.instant(), LEASE).orElseThrow();

        assertThat(active.id()).isEqualTo(first.id());
        assertThat(active.opts().repeat()).isEqualTo(new RepeatOptions("*/5 * * * *", "UTC"));
        assertThat(queue.counts().delayed()).isEqualTo(1);
        assertThat(queue.getRepeatableJobs().get(0).next())
                .isEqualTo(Instant.parse("2024-01-01T00:10:00Z").toEpochMilli());

        assertThat(queue.removeRepeatableByKey(first.repeatJobKey())).isTrue();
        assertThat(queue.removeRepeatableByKey(first.repeatJobKey())).isFalse();
        assertThat(queue.counts().delayed()).isZero();
        assertThat(queue.counts().repeatable()).isZero();
    }

    @Test
    @DisplayName("실패는 재시도 예약 후 시도 횟수를 다 쓰면 failed")
    void fail_then_failed() {
        queue.add("r", data("r"), JobOptions.builder().jobId("r").attempts(2).build());
        Instant now = clock.instant();

        BrokerJob active = queue.moveToActive(now, LEASE).orElseThrow();
        assertThat(queue.fail(active, "boom", now.plusSeconds(10), now)).isEqualTo(FailureOutcome.RETRY_SCHEDULED);
        assertThat(queue.promoteDelayed(now.plusSeconds(10))).isEqualTo(1);

        BrokerJob retried = queue.moveToActive(now.plusSeconds(10), LEASE).orElseThrow();
        assertThat(retried.attemptsMade()).isEqualTo(1);
        assertThat(queue.fail(retried, "boom", now.plusSeconds(20), now.plusSeconds(10)))
                .isEqualTo(FailureOutcome.FAILED);
        assertThat(queue.counts().failed()).isEqualTo(1);
        assertThat(queue.getJob("r").orElseThrow().failedReason()).isEqualTo("boom");
    }

    @Test
    @DisplayName("lease 가 만료된 active 작업을 되돌리고, 완료된 작업은 제거된다")
    void reclaim_and_complete() {
        queue.add("s", data("s"), JobOptions.builder().jobId("s").build());
        Instant now = clock.instant();
        queue.moveToActive(now, LEASE);

        assertThat(queue.reclaimStalled(now.plusSeconds(29))).isZero();
        assertThat(queue.reclaimStalled(now.plusSeconds(30))).isEqualTo(1);

        BrokerJob again = queue.moveToActive(now.plusSeconds(30), LEASE).orElseThrow();
        assertThat(queue.complete(again, now.plusSeconds(31))).isTrue();
        assertThat(queue.getJob("s")).isEmpty();
        assertThat(queue.counts().active()).isZero();
    }

    @Test
    @DisplayName("updateData 는 페이로드만 교체한다")
    void update_data() {
        queue.add("u", data("u"), JobOptions.builder().jobId("u").delay(1000L).build());

        assertThat(queue.updateData("u", data("u2"))).isTrue();
        assertThat(queue.updateData("missing", data("x"))).isFalse();
        assertThat(queue.getJob("u").orElseThrow().data().path("flowVersionId").asText()).isEqualTo("u2");
        assertThat(queue.getJob("u").orElseThrow().delay()).isEqualTo(1000L);
    }

    @Test
    @DisplayName("updateData 는 이미 지워진 작업의 hash 를 다시 만들지 않는다")
    void update_data_after_complete_leaves_no_hash() {
        queue.add("c", data("c"), JobOptions.builder().jobId("c").build());
        Instant now = clock.instant();
        BrokerJob active = queue.moveToActive(now, LEASE).orElseThrow();
        queue.complete(active, now);

        assertThat(queue.updateData("c", data("late"))).isFalse();
        assertThat(redis.hasKey(queue.jobKey("c"))).isFalse();

        BrokerJob readded = queue.add("c", data("c2"), JobOptions.builder().jobId("c").build());
        assertThat(readded.data().path("flowVersionId").asText()).isEqualTo("c2");
        assertThat(queue.counts().waiting()).isEqualTo(1);
    }

    private void putCorrupted(String jobId, String state) {
        redis.opsForHash().put(queue.jobKey(jobId), "name", jobId);
        redis.opsForHash().put(queue.jobKey(jobId), "data", "{not json");
        redis.opsForZSet().add(queue.key(state), jobId, 0);
    }

    @Test
    @DisplayName("깨진 작업 레코드는 목록에서 빠지고 보고된다")
    void get_jobs_skips_corrupted_record() {
        queue.add("good", data("good"), JobOptions.builder().jobId("good").delay(1000L).build());
        putCorrupted("bad", "delayed");

        assertThat(queue.getJobs()).extracting(BrokerJob::id).containsExactly("good");
        verify(reporter).report(any(CorruptedJobRecordException.class));
    }

    @Test
    @DisplayName("깨진 작업 레코드가 있어도 마이그레이션은 나머지 작업을 v4 로 올린다")
    void migration_continues_past_corrupted_record() {
        ObjectNode v1 = om.createObjectNode().put("projectId", "p-1").put("triggerType", "SCHEDULE");
        v1.putObject("flowVersion").put("id", "fv-9").put("flowId", "flow-9");
        BrokerJob good = queue.add("fv-9", v1, JobOptions.builder().jobId("fv-9")
                .repeat(new RepeatOptions("*/5 * * * *", "UTC")).build());
        putCorrupted("bad", "delayed");

        FlowScheduleService flowScheduleService = mock(FlowScheduleService.class);
        when(flowScheduleService.backfillCron(anyString(), anyString(), anyString())).thenReturn(true);
        FlowQueueMetrics metrics = new FlowQueueMetrics(new SimpleMeterRegistry());
        List<JobDataMigration> steps = List.of(
                new V1ToV2Migration(),
                new ScheduleBackfillMigration(flowScheduleService, UnrepeatableJobPolicy.LOG, reporter, metrics,
                        queue.name()),
                new V3ToV4Migration());
        ScheduledJobMigrator migrator = new ScheduledJobMigrator(queue, new InMemoryLockService(), steps, reporter,
                metrics, Duration.ofMillis(100));

        MigrationReport report = migrator.migrate();

        assertThat(report.migratedJobs()).isEqualTo(1);
        assertThat(queue.getJob(good.id()).orElseThrow().data().path("schemaVersion").asInt()).isEqualTo(4);
        verify(reporter, atLeastOnce()).report(any(CorruptedJobRecordException.class));
    }

    @Test
    @DisplayName("꺼낸 작업 레코드가 깨져 있으면 재시도 없이 failed 로 보낸다")
    void corrupted_record_goes_to_failed_on_pickup() {
        putCorrupted("bad", "wait");
        queue.add("next", data("next"), JobOptions.builder().jobId("next").priority(2).build());
        Instant now = clock.instant();

        assertThat(queue.moveToActive(now, LEASE)).isEmpty();
        assertThat(queue.counts().active()).isZero();
        assertThat(queue.counts().failed()).isEqualTo(1);
        assertThat(queue.reclaimStalled(now.plus(LEASE))).isZero();
        assertThat(queue.moveToActive(now, LEASE)).get().extracting(BrokerJob::id).isEqualTo("next");
        verify(reporter).report(any(CorruptedJobRecordException.class));
    }
}
