package com.yerin.flowq.migration;

/**
 * repeatableJobs 큐에서 repeat 옵션이 없는 작업을 만났을 때의 처리.
 * 어느 쪽이든 작업은 v2 에 그대로 남는다.
 */
public enum UnrepeatableJobPolicy {
    /** 에러 로그만 */
    LOG,
    /** ExceptionReporter 로도 보낸다 */
    REPORT
}
