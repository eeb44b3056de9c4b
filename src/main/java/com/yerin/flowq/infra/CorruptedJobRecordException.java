package com.yerin.flowq.infra;

/**
 * 브로커에 저장된 작업 hash 의 data/opts 를 역직렬화할 수 없을 때.
 */
public class CorruptedJobRecordException extends IllegalStateException {

    private final String jobId;

    public CorruptedJobRecordException(String jobId, String queue, Throwable cause) {
        super("corrupted job record jobId=" + jobId + " queue=" + queue, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
