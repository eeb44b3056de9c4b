package com.yerin.flowq.dto.response;

import com.yerin.flowq.domain.JobCounts;
import com.yerin.flowq.domain.JobQueue;

public record QueueSnapshotResponse(
        String queue,
        long waiting,
        long delayed,
        long active,
        long completed,
        long failed,
        long repeatable
) {
    public static QueueSnapshotResponse from(JobQueue queue) {
        JobCounts c = queue.counts();
        return new QueueSnapshotResponse(
                queue.name(),
                c.waiting(),
                c.delayed(),
                c.active(),
                c.completed(),
                c.failed(),
                c.repeatable()
        );
    }
}
