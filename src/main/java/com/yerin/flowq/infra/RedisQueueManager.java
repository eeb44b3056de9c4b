package com.yerin.flowq.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.flowq.domain.FlowQueueMetrics;
import com.yerin.flowq.domain.JobOptions;
import com.yerin.flowq.domain.JobQueue;
import com.yerin.flowq.global.exception.ExceptionReporter;
import com.yerin.flowq.migration.MigrationReport;
import com.yerin.flowq.migration.ScheduledJobMigrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 여러 프로세스가 공유하는 Redis 백엔드. 반복 키 매핑도 Redis 에 두어 재시작 후에도 유지된다.
 */
@Slf4j
public class RedisQueueManager extends AbstractQueueManager {

    private final StringRedisTemplate redis;
    private final ScheduledJobMigrator migrator;
    private final String prefix;

    private volatile MigrationReport lastMigrationReport;

    public RedisQueueManager(JobQueue oneTimeQueue,
                             JobQueue scheduledQueue,
                             JobOptions defaultJobOptions,
                             StringRedisTemplate redis,
                             ScheduledJobMigrator migrator,
                             String prefix,
                             ObjectMapper objectMapper,
                             ExceptionReporter exceptionReporter,
                             FlowQueueMetrics metrics) {
        super(oneTimeQueue, scheduledQueue, defaultJobOptions, objectMapper, exceptionReporter, metrics);
        this.redis = redis;
        this.migrator = migrator;
        this.prefix = prefix;
    }

    @Override
    public void init() {
        log.info("[RedisQueue#init] Initializing redis queues {}, {}", oneTimeQueue.name(), scheduledQueue.name());
        String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
        log.debug("[RedisQueue#init] ping={}", pong);
        lastMigrationReport = migrator.migrate();
    }

    public MigrationReport lastMigrationReport() {
        return lastMigrationReport;
    }

    String repeatingJobKey(String id) {
        return prefix + ":repeatJobKey:" + id;
    }

    @Override
    protected String loadRepeatJobKey(String id) {
        return redis.opsForValue().get(repeatingJobKey(id));
    }

    @Override
    protected void saveRepeatJobKey(String id, String repeatJobKey) {
        redis.opsForValue().set(repeatingJobKey(id), repeatJobKey);
    }

    @Override
    protected void deleteRepeatJobKey(String id) {
        redis.delete(repeatingJobKey(id));
    }
}
