package com.yerin.flowq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.flowq.application.FlowJobHandlerRegistry;
import com.yerin.flowq.domain.FlowQueueMetrics;
import com.yerin.flowq.domain.JobOptions;
import com.yerin.flowq.domain.QueueMode;
import com.yerin.flowq.global.exception.ExceptionReporter;
import com.yerin.flowq.infra.FlowWorker;
import com.yerin.flowq.infra.InMemoryJobQueue;
import com.yerin.flowq.infra.RedisJobQueue;
import com.yerin.flowq.infra.lock.InMemoryLockService;
import com.yerin.flowq.infra.lock.LockService;
import com.yerin.flowq.infra.lock.RedisLockService;
import com.yerin.flowq.migration.ScheduledJobMigrator;
import com.yerin.flowq.service.FlowQueue;
import com.yerin.flowq.service.FlowScheduleService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("큐 백엔드 선택 설정 테스트")
public class FlowQueueConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(FlowQueueConfig.class)
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(FlowQueueMetrics.class, () -> new FlowQueueMetrics(new SimpleMeterRegistry()))
            .withBean(ExceptionReporter.class, () -> mock(ExceptionReporter.class))
            .withBean(FlowJobHandlerRegistry.class, () -> new FlowJobHandlerRegistry(List.of()))
            .withBean(StringRedisTemplate.class, () -> mock(StringRedisTemplate.class))
            .withBean(FlowScheduleService.class, () -> mock(FlowScheduleService.class));

    @Test
    @DisplayName("MEMORY 모드는 인메모리 큐와 락을 쓰고 마이그레이터가 없다")
    void memory_mode() {
        runner.withPropertyValues("flowq.queue.mode=MEMORY").run(ctx -> {
            assertThat(ctx.getBean(FlowQueue.class).mode()).isEqualTo(QueueMode.MEMORY);
            assertThat(ctx.getBean("oneTimeJobQueue")).isInstanceOf(InMemoryJobQueue.class);
            assertThat(ctx.getBean(LockService.class)).isInstanceOf(InMemoryLockService.class);
            assertThat(ctx).doesNotHaveBean(ScheduledJobMigrator.class);
            assertThat(ctx).hasSingleBean(FlowWorker.class);
        });
    }

    @Test
    @DisplayName("모드를 지정하지 않으면 REDIS")
    void redis_is_default() {
        runner.run(ctx -> {
            assertThat(ctx.getBean(FlowQueue.class).mode()).isEqualTo(QueueMode.REDIS);
            assertThat(ctx.getBean("scheduledJobQueue")).isInstanceOf(RedisJobQueue.class);
            assertThat(ctx.getBean(LockService.class)).isInstanceOf(RedisLockService.class);
            assertThat(ctx).hasSingleBean(ScheduledJobMigrator.class);
        });
    }

    @Test
    @DisplayName("기본 재시도 옵션은 5회, 지수 백오프 8분")
    void default_job_options() {
        runner.withPropertyValues("flowq.queue.mode=memory").run(ctx -> {
            JobOptions opts = ctx.getBean(JobOptions.class);
            assertThat(opts.attempts()).isEqualTo(5);
            assertThat(opts.backoff()).isEqualTo(new JobOptions.BackoffOptions("exponential", 480_000));
            assertThat(opts.removeOnComplete()).isTrue();
        });
    }

    @Test
    @DisplayName("worker.enabled=false 면 워커를 만들지 않는다")
    void worker_can_be_disabled() {
        runner.withPropertyValues("flowq.queue.mode=MEMORY", "flowq.worker.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(FlowWorker.class));
    }
}
