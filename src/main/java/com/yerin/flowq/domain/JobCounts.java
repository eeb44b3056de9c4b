package com.yerin.flowq.domain;

public record JobCounts(
        long waiting,
        long delayed,
        long active,
        long completed,
        long failed,
        long repeatable
) {}
