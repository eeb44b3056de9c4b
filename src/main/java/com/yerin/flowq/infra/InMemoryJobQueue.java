package com.yerin.flowq.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.flowq.domain.*;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 프로세스 메모리에만 존재하는 큐. 재시작하면 모두 사라진다.
 * 정렬/우선순위/재시도 규칙은 {@link RedisJobQueue} 와 같다.
 */
@Slf4j
public class InMemoryJobQueue implements JobQueue {

    private final String name;
    private final Clock clock;

    private final Map<String, StoredJob> jobs = new HashMap<>();
    private final NavigableMap<Slot, String> waiting = new TreeMap<>();
    private final NavigableMap<Slot, String> delayed = new TreeMap<>();
    private final Map<String, Long> active = new LinkedHashMap<>();
    private final Map<String, Long> completed = new LinkedHashMap<>();
    private final Map<String, Long> failed = new LinkedHashMap<>();
    private final Map<String, RepeatableJob> repeatables = new LinkedHashMap<>();

    private long seq;
    private long autoId;

    public InMemoryJobQueue(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized BrokerJob add(String jobName, JsonNode data, JobOptions opts) {
        if (opts.repeat() != null) {
            return addRepeatable(jobName, data, opts);
        }
        String jobId = opts.jobId() != null ? opts.jobId() : String.valueOf(++autoId);
        StoredJob existing = jobs.get(jobId);
        if (existing != null) {
            log.debug("[InMemoryQueue] duplicate jobId={} queue={}", jobId, name);
            return existing.snapshot();
        }

        long now = clock.millis();
        StoredJob job = new StoredJob(jobId, jobName, data.deepCopy(), opts, now, opts.delayOrZero(), null);
        jobs.put(jobId, job);
        if (job.delay > 0) {
            toDelayed(job, now + job.delay);
        } else {
            toWaiting(job);
        }
        return job.snapshot();
    }

    private BrokerJob addRepeatable(String jobName, JsonNode data, JobOptions opts) {
        RepeatOptions repeat = opts.repeat();
        String repeatKey = RepeatKeys.repeatKey(jobName, opts.jobId(), repeat);
        long now = clock.millis();

        RepeatableJob registered = repeatables.get(repeatKey);
        if (registered != null) {
            log.debug("[InMemoryQueue] repeat already registered key={}", repeatKey);
            return repeatInstance(repeatKey, registered.next(), jobName, data, opts, now);
        }

        long next = repeat.nextAfter(Instant.ofEpochMilli(now)).toEpochMilli();
        repeatables.put(repeatKey, new RepeatableJob(repeatKey, jobName, opts.jobId(), repeat.pattern(), repeat.tz(), next));
        createRepeatInstance(repeatKey, jobName, data, opts, now, next);
        return repeatInstance(repeatKey, next, jobName, data, opts, now);
    }

    private BrokerJob repeatInstance(String repeatKey, long next, String jobName, JsonNode data,
                                     JobOptions opts, long now) {
        StoredJob instance = jobs.get(RepeatKeys.instanceId(repeatKey, next));
        if (instance != null) return instance.snapshot();
        return new BrokerJob(RepeatKeys.instanceId(repeatKey, next), jobName, data.deepCopy(), opts,
                now, next - now, 0, repeatKey, null, null);
    }

    private void createRepeatInstance(String repeatKey, String jobName, JsonNode data, JobOptions opts,
                                      long now, long next) {
        String instanceId = RepeatKeys.instanceId(repeatKey, next);
        if (jobs.containsKey(instanceId)) return;
        StoredJob instance = new StoredJob(instanceId, jobName, data.deepCopy(), opts, now, next - now, repeatKey);
        jobs.put(instanceId, instance);
        toDelayed(instance, next);
    }

    @Override
    public synchronized Optional<BrokerJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(StoredJob::snapshot);
    }

    @Override
    public synchronized List<BrokerJob> getJobs() {
        List<BrokerJob> out = new ArrayList<>();
        for (StoredJob j : jobs.values()) {
            if (!completed.containsKey(j.id)) out.add(j.snapshot());
        }
        return out;
    }

    @Override
    public synchronized boolean updateData(String jobId, JsonNode data) {
        StoredJob job = jobs.get(jobId);
        if (job == null) return false;
        job.data = data.deepCopy();
        return true;
    }

    @Override
    public synchronized List<RepeatableJob> getRepeatableJobs() {
        return new ArrayList<>(repeatables.values());
    }

    @Override
    public synchronized boolean removeRepeatableByKey(String repeatJobKey) {
        RepeatableJob removed = repeatables.remove(repeatJobKey);
        if (removed == null) return false;

        StoredJob pending = jobs.get(RepeatKeys.instanceId(repeatJobKey, removed.next()));
        if (pending != null && pending.slot != null) {
            delayed.remove(pending.slot);
            waiting.remove(pending.slot);
            jobs.remove(pending.id);
        }
        return true;
    }

    @Override
    public synchronized int promoteDelayed(Instant now) {
        int moved = 0;
        while (!delayed.isEmpty() && delayed.firstKey().score() <= now.toEpochMilli()) {
            StoredJob job = jobs.get(delayed.pollFirstEntry().getValue());
            if (job == null) continue;
            toWaiting(job);
            moved++;
        }
        return moved;
    }

    @Override
    public synchronized Optional<BrokerJob> moveToActive(Instant now, Duration lease) {
        Map.Entry<Slot, String> head = waiting.pollFirstEntry();
        if (head == null) return Optional.empty();

        StoredJob job = jobs.get(head.getValue());
        job.slot = null;
        job.processedOn = now.toEpochMilli();
        active.put(job.id, now.plus(lease).toEpochMilli());

        if (job.repeatJobKey != null) {
            scheduleNextRepeat(job, now);
        }
        return Optional.of(job.snapshot());
    }

    private void scheduleNextRepeat(StoredJob job, Instant now) {
        RepeatableJob registered = repeatables.get(job.repeatJobKey);
        if (registered == null || job.opts.repeat() == null) return;

        long after = Math.max(now.toEpochMilli(), job.timestamp + job.delay);
        long next = job.opts.repeat().nextAfter(Instant.ofEpochMilli(after)).toEpochMilli();
        repeatables.put(job.repeatJobKey, new RepeatableJob(registered.key(), registered.name(),
                registered.jobId(), registered.pattern(), registered.tz(), next));
        createRepeatInstance(job.repeatJobKey, job.name, job.data, job.opts, now.toEpochMilli(), next);
    }

    @Override
    public synchronized boolean complete(BrokerJob job, Instant now) {
        if (active.remove(job.id()) == null) return false;
        StoredJob stored = jobs.get(job.id());
        if (stored == null) return true;
        if (stored.opts.removeOnCompleteOrDefault()) {
            jobs.remove(job.id());
        } else {
            completed.put(job.id(), now.toEpochMilli());
        }
        return true;
    }

    @Override
    public synchronized FailureOutcome fail(BrokerJob job, String reason, Instant retryAt, Instant now) {
        if (active.remove(job.id()) == null) return FailureOutcome.LOST;
        StoredJob stored = jobs.get(job.id());
        if (stored == null) return FailureOutcome.LOST;

        stored.attemptsMade++;
        stored.failedReason = reason;
        if (stored.attemptsMade < stored.opts.attemptsOrDefault()) {
            toDelayed(stored, retryAt.toEpochMilli());
            return FailureOutcome.RETRY_SCHEDULED;
        }
        failed.put(stored.id, now.toEpochMilli());
        return FailureOutcome.FAILED;
    }

    @Override
    public synchronized int reclaimStalled(Instant now) {
        List<String> expired = new ArrayList<>();
        for (Map.Entry<String, Long> e : active.entrySet()) {
            if (e.getValue() <= now.toEpochMilli()) expired.add(e.getKey());
        }
        for (String id : expired) {
            active.remove(id);
            StoredJob job = jobs.get(id);
            if (job != null) toWaiting(job);
        }
        return expired.size();
    }

    @Override
    public synchronized JobCounts counts() {
        return new JobCounts(waiting.size(), delayed.size(), active.size(), completed.size(), failed.size(),
                repeatables.size());
    }

    private void toWaiting(StoredJob job) {
        job.slot = new Slot(job.opts.priorityOrDefault(), ++seq);
        waiting.put(job.slot, job.id);
    }

    private void toDelayed(StoredJob job, long dueAt) {
        job.slot = new Slot(dueAt, ++seq);
        delayed.put(job.slot, job.id);
    }

    private record Slot(long score, long seq) implements Comparable<Slot> {
        @Override
        public int compareTo(Slot o) {
            int c = Long.compare(score, o.score);
            return c != 0 ? c : Long.compare(seq, o.seq);
        }
    }

    private static final class StoredJob {
        final String id;
        final String name;
        final JobOptions opts;
        final long timestamp;
        final long delay;
        final String repeatJobKey;
        JsonNode data;
        int attemptsMade;
        Long processedOn;
        String failedReason;
        Slot slot;

        StoredJob(String id, String name, JsonNode data, JobOptions opts, long timestamp, long delay,
                  String repeatJobKey) {
            this.id = id;
            this.name = name;
            this.data = data;
            this.opts = opts;
            this.timestamp = timestamp;
            this.delay = delay;
            this.repeatJobKey = repeatJobKey;
        }

        BrokerJob snapshot() {
            return new BrokerJob(id, name, data.deepCopy(), opts, timestamp, delay, attemptsMade,
                    repeatJobKey, processedOn, failedReason);
        }
    }
}
