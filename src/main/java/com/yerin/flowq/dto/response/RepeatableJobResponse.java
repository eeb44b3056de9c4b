package com.yerin.flowq.dto.response;

import com.yerin.flowq.domain.RepeatableJob;

import java.time.Instant;

public record RepeatableJobResponse(
        String key,
        String jobId,
        String pattern,
        String tz,
        Instant next
) {
    public static RepeatableJobResponse from(RepeatableJob r) {
        return new RepeatableJobResponse(r.key(), r.jobId(), r.pattern(), r.tz(), Instant.ofEpochMilli(r.next()));
    }
}
