package com.yerin.flowq.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * 브로커가 보관하는 작업 레코드의 스냅샷.
 */
public record BrokerJob(
        String id,
        String name,
        JsonNode data,
        JobOptions opts,
        long timestamp,
        long delay,
        int attemptsMade,
        String repeatJobKey,
        Long processedOn,
        String failedReason
) {

    public Instant dueAt() {
        return Instant.ofEpochMilli(timestamp + delay);
    }

    public boolean isRepeatInstance() {
        return repeatJobKey != null;
    }
}
