package com.yerin.flowq.domain.data;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * repeatableJobs 큐에 실리는 최신(v4) 페이로드.
 * DELAYED_FLOW 는 일시 정지된 실행을 재개하므로 runId 를 가진다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduledJobData(
        int schemaVersion,
        String flowVersionId,
        String flowId,
        String projectId,
        RunEnvironment environment,
        String triggerType,
        RepeatableJobType jobType,
        String runId
) implements JobData {

    public static ScheduledJobData executeTrigger(String flowVersionId, String flowId, String projectId,
                                                  String triggerType) {
        return new ScheduledJobData(JobDataSchema.LATEST_VERSION, flowVersionId, flowId, projectId,
                RunEnvironment.PRODUCTION, triggerType, RepeatableJobType.EXECUTE_TRIGGER, null);
    }

    public static ScheduledJobData delayedFlow(String runId, String flowVersionId, String flowId,
                                               String projectId, RunEnvironment environment) {
        return new ScheduledJobData(JobDataSchema.LATEST_VERSION, flowVersionId, flowId, projectId,
                environment, null, RepeatableJobType.DELAYED_FLOW, runId);
    }
}
