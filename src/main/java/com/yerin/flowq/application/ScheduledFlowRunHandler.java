package com.yerin.flowq.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.flowq.config.FlowQueueConfig;
import com.yerin.flowq.domain.BrokerJob;
import com.yerin.flowq.domain.data.ScheduledJobData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Slf4j
@Profile("!test")
@Component
@RequiredArgsConstructor
public class ScheduledFlowRunHandler implements FlowJobHandler {

    private final ObjectMapper objectMapper;

    @Override
    public String queue() {
        return FlowQueueConfig.SCHEDULED_QUEUE;
    }

    @Override
    public int handle(BrokerJob job) {
        try {
            ScheduledJobData data = objectMapper.treeToValue(job.data(), ScheduledJobData.class);
            log.info("[Handler.scheduled] jobId={}, jobType={}, flowVersionId={}, repeat={}",
                    job.id(), data.jobType(), data.flowVersionId(), job.isRepeatInstance());
            return 1;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload parse error jobId=" + job.id(), e);
        }
    }
}
