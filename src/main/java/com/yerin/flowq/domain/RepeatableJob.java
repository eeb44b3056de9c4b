package com.yerin.flowq.domain;

public record RepeatableJob(
        String key,
        String name,
        String jobId,
        String pattern,
        String tz,
        long next
) {}
