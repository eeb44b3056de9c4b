package com.yerin.flowq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.flowq.application.FlowJobHandlerRegistry;
import com.yerin.flowq.application.FlowRunHooks;
import com.yerin.flowq.application.FlowWorkerHooks;
import com.yerin.flowq.domain.FlowQueueMetrics;
import com.yerin.flowq.domain.JobOptions;
import com.yerin.flowq.domain.JobQueue;
import com.yerin.flowq.domain.QueueMode;
import com.yerin.flowq.global.exception.ExceptionReporter;
import com.yerin.flowq.infra.*;
import com.yerin.flowq.infra.lock.InMemoryLockService;
import com.yerin.flowq.infra.lock.LockService;
import com.yerin.flowq.infra.lock.RedisLockService;
import com.yerin.flowq.migration.*;
import com.yerin.flowq.service.FlowQueue;
import com.yerin.flowq.service.FlowScheduleService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * flowq.queue.mode 로 백엔드를 한 번 고른다. (MEMORY | REDIS, 기본 REDIS)
 */
@Configuration
public class FlowQueueConfig {

    public static final String ONE_TIME_QUEUE = "oneTimeJobs";
    public static final String SCHEDULED_QUEUE = "repeatableJobs";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobOptions defaultJobOptions(@Value("${flowq.retry.attempts:5}") int attempts,
                                        @Value("${flowq.retry.backoff-delay-millis:480000}") long backoffDelayMillis) {
        return JobOptions.defaults(attempts, backoffDelayMillis);
    }

    @Bean
    @ConditionalOnMissingBean
    public FlowWorkerHooks flowWorkerHooks() {
        return new FlowWorkerHooks() {};
    }

    @Bean
    @ConditionalOnMissingBean
    public FlowRunHooks flowRunHooks() {
        return new FlowRunHooks() {};
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "flowq.queue.mode", havingValue = "MEMORY")
    static class MemoryQueueConfig {

        @Bean
        public JobQueue oneTimeJobQueue(Clock clock) {
            return new InMemoryJobQueue(ONE_TIME_QUEUE, clock);
        }

        @Bean
        public JobQueue scheduledJobQueue(Clock clock) {
            return new InMemoryJobQueue(SCHEDULED_QUEUE, clock);
        }

        // 메모리 모드에는 마이그레이션이 없어 이 락을 잡는 컴포넌트가 없다
        @Bean
        public LockService lockService() {
            return new InMemoryLockService();
        }

        @Bean
        public FlowQueue flowQueue(@Qualifier("oneTimeJobQueue") JobQueue oneTimeJobQueue,
                                   @Qualifier("scheduledJobQueue") JobQueue scheduledJobQueue,
                                   JobOptions defaultJobOptions,
                                   ObjectMapper objectMapper,
                                   ExceptionReporter exceptionReporter,
                                   FlowQueueMetrics metrics) {
            return new FlowQueue(QueueMode.MEMORY, new InMemoryQueueManager(oneTimeJobQueue, scheduledJobQueue,
                    defaultJobOptions, objectMapper, exceptionReporter, metrics));
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "flowq.queue.mode", havingValue = "REDIS", matchIfMissing = true)
    static class RedisQueueConfig {

        @Value("${flowq.redis.prefix:flowq}")
        private String prefix;

        @Bean
        public JobQueue oneTimeJobQueue(StringRedisTemplate redis, ObjectMapper objectMapper,
                                        ExceptionReporter exceptionReporter, Clock clock) {
            return new RedisJobQueue(ONE_TIME_QUEUE, prefix, redis, objectMapper, exceptionReporter, clock);
        }

        @Bean
        public JobQueue scheduledJobQueue(StringRedisTemplate redis, ObjectMapper objectMapper,
                                          ExceptionReporter exceptionReporter, Clock clock) {
            return new RedisJobQueue(SCHEDULED_QUEUE, prefix, redis, objectMapper, exceptionReporter, clock);
        }

        @Bean
        public LockService lockService(StringRedisTemplate redis,
                                       @Value("${flowq.lock.retry-interval-millis:100}") long retryIntervalMillis) {
            return new RedisLockService(redis, prefix, Duration.ofMillis(retryIntervalMillis));
        }

        @Bean
        public ScheduledJobMigrator scheduledJobMigrator(
                @Qualifier("scheduledJobQueue") JobQueue scheduledJobQueue,
                LockService lockService,
                FlowScheduleService flowScheduleService,
                ExceptionReporter exceptionReporter,
                FlowQueueMetrics metrics,
                @Value("${flowq.migration.lock-timeout-millis:30000}") long lockTimeoutMillis,
                @Value("${flowq.migration.unrepeatable-job-policy:LOG}") UnrepeatableJobPolicy policy) {
            List<JobDataMigration> steps = List.of(
                    new V1ToV2Migration(),
                    new ScheduleBackfillMigration(flowScheduleService, policy, exceptionReporter, metrics,
                            scheduledJobQueue.name()),
                    new V3ToV4Migration());
            return new ScheduledJobMigrator(scheduledJobQueue, lockService, steps, exceptionReporter, metrics,
                    Duration.ofMillis(lockTimeoutMillis));
        }

        @Bean
        public FlowQueue flowQueue(@Qualifier("oneTimeJobQueue") JobQueue oneTimeJobQueue,
                                   @Qualifier("scheduledJobQueue") JobQueue scheduledJobQueue,
                                   JobOptions defaultJobOptions,
                                   StringRedisTemplate redis,
                                   ScheduledJobMigrator scheduledJobMigrator,
                                   ObjectMapper objectMapper,
                                   ExceptionReporter exceptionReporter,
                                   FlowQueueMetrics metrics) {
            return new FlowQueue(QueueMode.REDIS, new RedisQueueManager(oneTimeJobQueue, scheduledJobQueue,
                    defaultJobOptions, redis, scheduledJobMigrator, prefix, objectMapper, exceptionReporter, metrics));
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "flowq.worker.enabled", havingValue = "true", matchIfMissing = true)
    static class WorkerConfig {

        @Bean
        public FlowWorker flowWorker(List<JobQueue> queues,
                                     FlowJobHandlerRegistry registry,
                                     FlowWorkerHooks workerHooks,
                                     FlowRunHooks runHooks,
                                     ExceptionReporter exceptionReporter,
                                     FlowQueueMetrics metrics,
                                     Clock clock,
                                     @Value("${flowq.worker.concurrency:1}") int concurrency,
                                     @Value("${flowq.worker.lease-millis:30000}") long leaseMillis,
                                     @Value("${flowq.worker.poll-millis:500}") long pollMillis) {
            return new FlowWorker(queues, registry, workerHooks, runHooks, exceptionReporter, metrics, clock,
                    concurrency, Duration.ofMillis(leaseMillis), pollMillis);
        }

        @Bean
        public DelayedJobPromoter delayedJobPromoter(List<JobQueue> queues, Clock clock) {
            return new DelayedJobPromoter(queues, clock);
        }

        @Bean
        public StalledJobReaper stalledJobReaper(List<JobQueue> queues, FlowQueueMetrics metrics, Clock clock) {
            return new StalledJobReaper(queues, metrics, clock);
        }
    }
}
