package com.yerin.flowq.domain.data;

/**
 * 큐 작업에 실리는 페이로드. 모든 버전은 schemaVersion 을 가진다.
 */
public interface JobData {

    int schemaVersion();

    String projectId();
}
