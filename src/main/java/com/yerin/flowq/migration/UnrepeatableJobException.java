package com.yerin.flowq.migration;

import lombok.Getter;

@Getter
public class UnrepeatableJobException extends RuntimeException {

    private final String jobId;

    public UnrepeatableJobException(String jobId, String queue) {
        super("Found unrepeatable job in repeatable queue jobId=" + jobId + " queue=" + queue);
        this.jobId = jobId;
    }
}
