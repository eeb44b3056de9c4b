package com.yerin.flowq.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.flowq.domain.*;
import com.yerin.flowq.global.exception.ExceptionReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Redis 위에 구현한 브로커 큐. 상태 전이는 모두 Lua 스크립트 하나로 처리되므로
 * 여러 워커 프로세스가 같은 큐를 공유해도 된다.
 * <pre>
 * {prefix}:{queue}:job:{id}          작업 hash
 * {prefix}:{queue}:wait              zset, score = priority * 2^32 + seq
 * {prefix}:{queue}:delayed           zset, score = 실행 예정 시각(ms)
 * {prefix}:{queue}:active            zset, score = lease 만료 시각(ms)
 * {prefix}:{queue}:completed|failed  zset, score = 종료 시각(ms)
 * {prefix}:{queue}:repeat            zset, member = repeatKey, score = 다음 실행 시각(ms)
 * {prefix}:{queue}:repeat:{key}      반복 스케줄 메타 hash
 * </pre>
 */
@Slf4j
public class RedisJobQueue implements JobQueue {

    private static final RedisScript<Long> ADD_JOB = script("addJob.lua", Long.class);
    private static final RedisScript<String> ADD_REPEATABLE = script("addRepeatable.lua", String.class);
    private static final RedisScript<Long> REMOVE_REPEATABLE = script("removeRepeatable.lua", Long.class);
    private static final RedisScript<Long> MOVE_TO_WAIT = script("moveToWait.lua", Long.class);
    private static final RedisScript<String> MOVE_TO_ACTIVE = script("moveToActive.lua", String.class);
    private static final RedisScript<Long> COMPLETE_JOB = script("completeJob.lua", Long.class);
    private static final RedisScript<Long> FAIL_JOB = script("failJob.lua", Long.class);
    private static final RedisScript<Long> DISCARD_JOB = script("discardJob.lua", Long.class);
    private static final RedisScript<Long> UPDATE_DATA = script("updateData.lua", Long.class);

    private static final String BATCH = "1000";

    private final String name;
    private final String base;
    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final ExceptionReporter exceptionReporter;
    private final Clock clock;

    public RedisJobQueue(String name, String prefix, StringRedisTemplate redis, ObjectMapper objectMapper,
                         ExceptionReporter exceptionReporter, Clock clock) {
        this.name = name;
        this.base = prefix + ":" + name + ":";
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.exceptionReporter = exceptionReporter;
        this.clock = clock;
    }

    private static <T> RedisScript<T> script(String file, Class<T> resultType) {
        DefaultRedisScript<T> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/" + file)));
        script.setResultType(resultType);
        return script;
    }

    @Override
    public String name() {
        return name;
    }

    String key(String suffix) {
        return base + suffix;
    }

    String jobKeyPrefix() {
        return base + "job:";
    }

    String jobKey(String jobId) {
        return jobKeyPrefix() + jobId;
    }

    String repeatMetaKey(String repeatKey) {
        return base + "repeat:" + repeatKey;
    }

    @Override
    public BrokerJob add(String jobName, JsonNode data, JobOptions opts) {
        if (opts.repeat() != null) {
            return addRepeatable(jobName, data, opts);
        }
        String jobId = opts.jobId() != null
                ? opts.jobId()
                : String.valueOf(redis.opsForValue().increment(key("id")));
        long now = clock.millis();
        long delay = opts.delayOrZero();

        Long created = redis.execute(ADD_JOB,
                List.of(jobKey(jobId), key("wait"), key("delayed"), key("seq")),
                jobId, jobName, write(data), write(opts), String.valueOf(now), String.valueOf(delay),
                String.valueOf(opts.priorityOrDefault()), String.valueOf(opts.attemptsOrDefault()),
                String.valueOf(opts.backoffDelayOrZero()), String.valueOf(now + delay));

        BrokerJob job = new BrokerJob(jobId, jobName, data, opts, now, delay, 0, null, null, null);
        if (created == null || created == 0L) {
            log.debug("[RedisQueue] duplicate jobId={} queue={}", jobId, name);
            return getJob(jobId).orElse(job);
        }
        log.debug("[RedisQueue] added jobId={} queue={} delay={} priority={}", jobId, name, delay,
                opts.priority());
        return job;
    }

    private BrokerJob addRepeatable(String jobName, JsonNode data, JobOptions opts) {
        RepeatOptions repeat = opts.repeat();
        String repeatKey = RepeatKeys.repeatKey(jobName, opts.jobId(), repeat);
        long now = clock.millis();
        long next = repeat.nextAfter(Instant.ofEpochMilli(now)).toEpochMilli();

        String scheduled = scheduleRepeat(repeatKey, next, jobName, data, opts, now, "add");
        long scheduledNext = scheduled == null ? next : parseScore(scheduled);
        String instanceId = RepeatKeys.instanceId(repeatKey, scheduledNext);
        log.debug("[RedisQueue] repeat key={} next={} queue={}", repeatKey, scheduledNext, name);

        return getJob(instanceId).orElse(new BrokerJob(instanceId, jobName, data, opts, now,
                scheduledNext - now, 0, repeatKey, null, null));
    }

    private String scheduleRepeat(String repeatKey, long next, String jobName, JsonNode data, JobOptions opts,
                                  long now, String mode) {
        RepeatOptions repeat = opts.repeat();
        return redis.execute(ADD_REPEATABLE,
                List.of(key("repeat"), repeatMetaKey(repeatKey), key("delayed")),
                repeatKey, String.valueOf(next), RepeatKeys.instanceId(repeatKey, next), jobKeyPrefix(),
                jobName, write(data), write(opts), String.valueOf(now), String.valueOf(opts.priorityOrDefault()),
                String.valueOf(opts.attemptsOrDefault()), String.valueOf(opts.backoffDelayOrZero()),
                opts.jobId() == null ? "" : opts.jobId(), repeat.pattern(), repeat.tz(), mode);
    }

    @Override
    public Optional<BrokerJob> getJob(String jobId) {
        Map<Object, Object> hash = redis.opsForHash().entries(jobKey(jobId));
        if (hash == null || hash.isEmpty()) return Optional.empty();
        return Optional.of(fromHash(jobId, hash));
    }

    @Override
    public List<BrokerJob> getJobs() {
        Set<String> ids = new LinkedHashSet<>();
        for (String state : List.of("wait", "delayed", "active", "failed")) {
            Set<String> members = redis.opsForZSet().range(key(state), 0, -1);
            if (members != null) ids.addAll(members);
        }
        List<BrokerJob> jobs = new ArrayList<>(ids.size());
        for (String id : ids) {
            try {
                getJob(id).ifPresent(jobs::add);
            } catch (CorruptedJobRecordException e) {
                log.warn("[RedisQueue] skip corrupted jobId={} queue={}", id, name);
                exceptionReporter.report(e);
            }
        }
        return jobs;
    }

    @Override
    public boolean updateData(String jobId, JsonNode data) {
        Long updated = redis.execute(UPDATE_DATA, List.of(jobKey(jobId)), write(data));
        return updated != null && updated == 1L;
    }

    @Override
    public List<RepeatableJob> getRepeatableJobs() {
        Set<ZSetOperations.TypedTuple<String>> tuples = redis.opsForZSet().rangeWithScores(key("repeat"), 0, -1);
        if (tuples == null) return List.of();

        List<RepeatableJob> out = new ArrayList<>(tuples.size());
        for (ZSetOperations.TypedTuple<String> t : tuples) {
            String repeatKey = t.getValue();
            Map<Object, Object> meta = redis.opsForHash().entries(repeatMetaKey(repeatKey));
            long next = t.getScore() == null ? 0L : t.getScore().longValue();
            out.add(new RepeatableJob(repeatKey, str(meta, "name"), str(meta, "jobId"),
                    str(meta, "pattern"), str(meta, "tz"), next));
        }
        return out;
    }

    @Override
    public boolean removeRepeatableByKey(String repeatJobKey) {
        Long removed = redis.execute(REMOVE_REPEATABLE,
                List.of(key("repeat"), repeatMetaKey(repeatJobKey), key("delayed"), key("wait")),
                repeatJobKey, jobKeyPrefix(), RepeatKeys.instanceIdPrefix(repeatJobKey));
        return removed != null && removed == 1L;
    }

    @Override
    public int promoteDelayed(Instant now) {
        return moveToWait("delayed", now);
    }

    @Override
    public int reclaimStalled(Instant now) {
        return moveToWait("active", now);
    }

    private int moveToWait(String source, Instant now) {
        Long moved = redis.execute(MOVE_TO_WAIT, List.of(key(source), key("wait"), key("seq")),
                String.valueOf(now.toEpochMilli()), jobKeyPrefix(), BATCH);
        return moved == null ? 0 : moved.intValue();
    }

    @Override
    public Optional<BrokerJob> moveToActive(Instant now, Duration lease) {
        String jobId = redis.execute(MOVE_TO_ACTIVE, List.of(key("wait"), key("active")),
                String.valueOf(now.toEpochMilli()), String.valueOf(now.plus(lease).toEpochMilli()), jobKeyPrefix());
        if (jobId == null || jobId.isEmpty()) return Optional.empty();

        Optional<BrokerJob> job;
        try {
            job = getJob(jobId);
        } catch (CorruptedJobRecordException e) {
            discard(jobId, e, now);
            return Optional.empty();
        }
        if (job.isEmpty()) {
            log.warn("[RedisQueue] active job vanished jobId={} queue={}", jobId, name);
            redis.opsForZSet().remove(key("active"), jobId);
            return Optional.empty();
        }
        BrokerJob active = job.get();
        if (active.isRepeatInstance() && active.opts().repeat() != null) {
            scheduleNextRepeat(active, now);
        }
        return job;
    }

    private void discard(String jobId, CorruptedJobRecordException e, Instant now) {
        redis.execute(DISCARD_JOB, List.of(key("active"), jobKey(jobId), key("failed")),
                jobId, String.valueOf(now.toEpochMilli()), e.getMessage());
        log.warn("[RedisQueue] corrupted job moved to failed jobId={} queue={}", jobId, name);
        exceptionReporter.report(e);
    }

    private void scheduleNextRepeat(BrokerJob job, Instant now) {
        long after = Math.max(now.toEpochMilli(), job.dueAt().toEpochMilli());
        long next = job.opts().repeat().nextAfter(Instant.ofEpochMilli(after)).toEpochMilli();
        String scheduled = scheduleRepeat(job.repeatJobKey(), next, job.name(), job.data(), job.opts(),
                now.toEpochMilli(), "next");
        if (scheduled == null) {
            log.debug("[RedisQueue] repeat removed meanwhile key={}", job.repeatJobKey());
        }
    }

    @Override
    public boolean complete(BrokerJob job, Instant now) {
        Long done = redis.execute(COMPLETE_JOB, List.of(key("active"), jobKey(job.id()), key("completed")),
                job.id(), job.opts().removeOnCompleteOrDefault() ? "1" : "0", String.valueOf(now.toEpochMilli()));
        return done != null && done == 1L;
    }

    @Override
    public FailureOutcome fail(BrokerJob job, String reason, Instant retryAt, Instant now) {
        Long result = redis.execute(FAIL_JOB,
                List.of(key("active"), jobKey(job.id()), key("delayed"), key("failed")),
                job.id(), String.valueOf(now.toEpochMilli()), reason == null ? "" : reason,
                String.valueOf(retryAt.toEpochMilli()));
        if (result == null || result < 0) return FailureOutcome.LOST;
        return result == 1L ? FailureOutcome.RETRY_SCHEDULED : FailureOutcome.FAILED;
    }

    @Override
    public JobCounts counts() {
        return new JobCounts(card("wait"), card("delayed"), card("active"), card("completed"), card("failed"),
                card("repeat"));
    }

    private long card(String state) {
        Long size = redis.opsForZSet().zCard(key(state));
        return size == null ? 0L : size;
    }

    private BrokerJob fromHash(String jobId, Map<Object, Object> hash) {
        try {
            String data = str(hash, "data");
            String opts = str(hash, "opts");
            return new BrokerJob(
                    jobId,
                    str(hash, "name"),
                    data == null ? objectMapper.nullNode() : objectMapper.readTree(data),
                    opts == null ? JobOptions.builder().build() : objectMapper.readValue(opts, JobOptions.class),
                    num(hash, "timestamp", 0L),
                    num(hash, "delay", 0L),
                    (int) num(hash, "attemptsMade", 0L),
                    str(hash, "repeatJobKey"),
                    hash.containsKey("processedOn") ? num(hash, "processedOn", 0L) : null,
                    str(hash, "failedReason")
            );
        } catch (JsonProcessingException e) {
            throw new CorruptedJobRecordException(jobId, name, e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("job data is not serializable", e);
        }
    }

    private static String str(Map<Object, Object> hash, String field) {
        Object v = hash.get(field);
        return v == null ? null : v.toString();
    }

    private static long num(Map<Object, Object> hash, String field, long fallback) {
        String v = str(hash, field);
        return v == null || v.isEmpty() ? fallback : parseScore(v);
    }

    private static long parseScore(String value) {
        return (long) Double.parseDouble(value);
    }
}
