package com.yerin.flowq.domain;

public enum FailureOutcome {
    /** 재시도 예약됨 (delayed) */
    RETRY_SCHEDULED,
    /** 시도 횟수 소진 */
    FAILED,
    /** 이미 active 가 아님 (lease 만료 후 회수 등) */
    LOST
}
