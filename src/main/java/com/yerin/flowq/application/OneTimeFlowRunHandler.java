package com.yerin.flowq.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.flowq.config.FlowQueueConfig;
import com.yerin.flowq.domain.BrokerJob;
import com.yerin.flowq.domain.data.OneTimeJobData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * 즉시 실행 요청(oneTimeJobs). 실제 플로우 엔진 연동 전까지는 로그만 남긴다.
 */
@Slf4j
@Profile("!test")
@Component
@RequiredArgsConstructor
public class OneTimeFlowRunHandler implements FlowJobHandler {

    private final ObjectMapper objectMapper;

    @Override
    public String queue() {
        return FlowQueueConfig.ONE_TIME_QUEUE;
    }

    @Override
    public int handle(BrokerJob job) {
        try {
            OneTimeJobData data = objectMapper.treeToValue(job.data(), OneTimeJobData.class);
            log.info("[Handler.oneTime] jobId={}, runId={}, flowVersionId={}, executionType={}",
                    job.id(), data.runId(), data.flowVersionId(), data.executionType());
            return 1;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload parse error jobId=" + job.id(), e);
        }
    }
}
