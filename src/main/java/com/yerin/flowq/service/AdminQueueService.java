package com.yerin.flowq.service;

import com.yerin.flowq.domain.JobQueue;
import com.yerin.flowq.dto.response.QueueSnapshotResponse;
import com.yerin.flowq.dto.response.RepeatableJobResponse;
import com.yerin.flowq.global.exception.AppException;
import com.yerin.flowq.global.exception.code.QueueErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 보드용 읽기 전용 조회. 큐 상태를 바꾸는 연산은 두지 않는다.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "flowq.board.enabled", havingValue = "true")
public class AdminQueueService {

    private final List<JobQueue> queues;

    public List<QueueSnapshotResponse> snapshots() {
        return queues.stream().map(QueueSnapshotResponse::from).toList();
    }

    public QueueSnapshotResponse snapshot(String name) {
        return QueueSnapshotResponse.from(find(name));
    }

    public List<RepeatableJobResponse> repeatables(String name) {
        return find(name).getRepeatableJobs().stream().map(RepeatableJobResponse::from).toList();
    }

    private JobQueue find(String name) {
        return queues.stream()
                .filter(q -> q.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AppException(QueueErrorCode.QUEUE_NOT_FOUND.withDetail(name)));
    }
}
