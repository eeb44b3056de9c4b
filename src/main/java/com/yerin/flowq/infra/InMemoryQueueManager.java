package com.yerin.flowq.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.flowq.domain.FlowQueueMetrics;
import com.yerin.flowq.domain.JobOptions;
import com.yerin.flowq.domain.JobQueue;
import com.yerin.flowq.global.exception.ExceptionReporter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 단일 노드/로컬 개발용. 재시작하면 작업과 매핑이 모두 사라지므로 마이그레이션도 없다.
 */
@Slf4j
public class InMemoryQueueManager extends AbstractQueueManager {

    private final Map<String, String> repeatJobKeys = new ConcurrentHashMap<>();

    public InMemoryQueueManager(JobQueue oneTimeQueue,
                                JobQueue scheduledQueue,
                                JobOptions defaultJobOptions,
                                ObjectMapper objectMapper,
                                ExceptionReporter exceptionReporter,
                                FlowQueueMetrics metrics) {
        super(oneTimeQueue, scheduledQueue, defaultJobOptions, objectMapper, exceptionReporter, metrics);
    }

    @Override
    public void init() {
        log.info("[InMemoryQueue#init] queues {}, {} ready", oneTimeQueue.name(), scheduledQueue.name());
    }

    @Override
    protected String loadRepeatJobKey(String id) {
        return repeatJobKeys.get(id);
    }

    @Override
    protected void saveRepeatJobKey(String id, String repeatJobKey) {
        repeatJobKeys.put(id, repeatJobKey);
    }

    @Override
    protected void deleteRepeatJobKey(String id) {
        repeatJobKeys.remove(id);
    }
}
