package com.yerin.flowq.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.flowq.domain.*;
import com.yerin.flowq.global.exception.ExceptionReporter;
import com.yerin.flowq.global.exception.JobRemovalFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * 두 백엔드가 공유하는 add / removeRepeatingJob 흐름.
 * ONE_TIME 은 oneTimeJobs 큐, DELAYED / REPEATING 은 repeatableJobs 큐로 간다.
 * 반복 키(id → repeatJobKey) 저장소만 백엔드마다 다르다.
 */
@Slf4j
public abstract class AbstractQueueManager implements QueueManager {

    protected final JobQueue oneTimeQueue;
    protected final JobQueue scheduledQueue;
    protected final JobOptions defaultJobOptions;
    protected final ObjectMapper objectMapper;
    protected final ExceptionReporter exceptionReporter;
    protected final FlowQueueMetrics metrics;

    protected AbstractQueueManager(JobQueue oneTimeQueue,
                                   JobQueue scheduledQueue,
                                   JobOptions defaultJobOptions,
                                   ObjectMapper objectMapper,
                                   ExceptionReporter exceptionReporter,
                                   FlowQueueMetrics metrics) {
        this.oneTimeQueue = oneTimeQueue;
        this.scheduledQueue = scheduledQueue;
        this.defaultJobOptions = defaultJobOptions;
        this.objectMapper = objectMapper;
        this.exceptionReporter = exceptionReporter;
        this.metrics = metrics;
    }

    @Override
    public void add(AddParams params) {
        log.debug("[FlowQueue#add] type={} id={}", params.type(), params.id());
        JsonNode data = objectMapper.valueToTree(params.data());

        if (params instanceof AddParams.Repeating repeating) {
            BrokerJob job = scheduledQueue.add(repeating.id(), data, defaultJobOptions.toBuilder()
                    .jobId(repeating.id())
                    .repeat(repeating.repeatOptions())
                    .build());
            if (job.repeatJobKey() != null) {
                log.debug("[FlowQueue#add] repeatJobKey={}", job.repeatJobKey());
                saveRepeatJobKey(repeating.id(), job.repeatJobKey());
            }
        } else if (params instanceof AddParams.Delayed delayed) {
            log.info("[FlowQueue#add] flowRunId={} delay={}", delayed.id(), delayed.delayMs());
            scheduledQueue.add(delayed.id(), data, defaultJobOptions.toBuilder()
                    .jobId(delayed.id())
                    .delay(delayed.delayMs())
                    .build());
        } else if (params instanceof AddParams.OneTime oneTime) {
            oneTimeQueue.add(oneTime.id(), data, defaultJobOptions.toBuilder()
                    .jobId(oneTime.id())
                    .priority(JobPriority.brokerValueOf(oneTime.priority()))
                    .build());
        } else {
            throw new IllegalArgumentException("unsupported add params: " + params.getClass().getName());
        }
        metrics.incAdded(params.type());
    }

    @Override
    public void removeRepeatingJob(RemoveParams params) {
        String id = params.id();
        String jobKey = findRepeatableJobKey(id);
        if (jobKey == null) {
            // 트리거 활성화가 실패했던 경우 등. 호출자를 실패시키지 않고 기록만 남긴다.
            exceptionReporter.report(new IllegalStateException("Couldn't find job key for id \"" + id + "\""));
            return;
        }

        boolean removed = scheduledQueue.removeRepeatableByKey(jobKey);
        deleteRepeatJobKey(id);
        if (!removed) {
            metrics.incRemovalFailure();
            throw new JobRemovalFailureException(id);
        }
        metrics.incRepeatableRemoved();
        log.info("[FlowQueue#removeRepeatingJob] removed id={} key={}", id, jobKey);
    }

    /**
     * 저장된 매핑을 먼저 보고, 없을 때만 반복 큐 전체를 훑는다.
     */
    public String findRepeatableJobKey(String id) {
        String jobKey = loadRepeatJobKey(id);
        if (jobKey != null) return jobKey;

        log.warn("[FlowQueue] repeatJobKey not found for id={}, scanning repeatable queue", id);
        return scanRepeatableJobKey(id);
    }

    private String scanRepeatableJobKey(String id) {
        Set<String> registered = scheduledQueue.getRepeatableJobs().stream()
                .map(RepeatableJob::key)
                .collect(Collectors.toSet());
        if (registered.isEmpty()) return null;

        return scheduledQueue.getJobs().stream()
                .filter(j -> j.repeatJobKey() != null && registered.contains(j.repeatJobKey()))
                .filter(j -> j.data() != null && id.equals(j.data().path("flowVersionId").asText(null)))
                .map(BrokerJob::repeatJobKey)
                .findFirst()
                .orElse(null);
    }

    protected abstract String loadRepeatJobKey(String id);

    protected abstract void saveRepeatJobKey(String id, String repeatJobKey);

    protected abstract void deleteRepeatJobKey(String id);
}
