package com.yerin.flowq.domain.data;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OneTimeJobData(
        int schemaVersion,
        String runId,
        String flowVersionId,
        String projectId,
        RunEnvironment environment,
        ExecutionType executionType,
        JsonNode payload
) implements JobData {

    public static OneTimeJobData begin(String runId, String flowVersionId, String projectId,
                                       RunEnvironment environment, JsonNode payload) {
        return new OneTimeJobData(JobDataSchema.LATEST_VERSION, runId, flowVersionId, projectId,
                environment, ExecutionType.BEGIN, payload);
    }
}
