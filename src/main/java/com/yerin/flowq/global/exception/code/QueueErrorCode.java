package com.yerin.flowq.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum QueueErrorCode implements ErrorCode {
    JOB_REMOVAL_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "반복 작업을 제거하지 못했습니다.", "QUEUE-001"),
    QUEUE_NOT_INITIALIZED(HttpStatus.SERVICE_UNAVAILABLE, "큐가 아직 초기화되지 않았습니다.", "QUEUE-002"),
    LOCK_ACQUISITION_FAILURE(HttpStatus.CONFLICT, "락을 획득하지 못했습니다.", "QUEUE-003"),
    QUEUE_NOT_FOUND(HttpStatus.NOT_FOUND, "큐를 찾을 수 없습니다.", "QUEUE-004");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
