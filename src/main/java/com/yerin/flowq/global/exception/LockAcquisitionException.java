package com.yerin.flowq.global.exception;

import com.yerin.flowq.global.exception.code.QueueErrorCode;
import lombok.Getter;

import java.time.Duration;

@Getter
public class LockAcquisitionException extends AppException {

    private final String key;

    public LockAcquisitionException(String key, Duration timeout) {
        super(QueueErrorCode.LOCK_ACQUISITION_FAILURE.withDetail(
                "락을 획득하지 못했습니다. key=" + key + ", timeout=" + timeout.toMillis() + "ms"));
        this.key = key;
    }

    public LockAcquisitionException(String key, Throwable cause) {
        super(QueueErrorCode.LOCK_ACQUISITION_FAILURE.withDetail("락 획득이 중단되었습니다. key=" + key), cause);
        this.key = key;
    }
}
