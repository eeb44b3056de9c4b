package com.yerin.flowq.global.exception;

import com.yerin.flowq.global.exception.code.QueueErrorCode;
import lombok.Getter;

/**
 * 매핑된 반복 키가 있었는데 브로커가 해당 스케줄을 찾지 못한 경우.
 */
@Getter
public class JobRemovalFailureException extends AppException {

    private final String jobId;

    public JobRemovalFailureException(String jobId) {
        super(QueueErrorCode.JOB_REMOVAL_FAILURE.withDetail(
                QueueErrorCode.JOB_REMOVAL_FAILURE.getMessage() + " jobId=" + jobId));
        this.jobId = jobId;
    }
}
