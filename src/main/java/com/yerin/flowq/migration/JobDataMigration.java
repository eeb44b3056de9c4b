package com.yerin.flowq.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yerin.flowq.domain.BrokerJob;

import java.util.Optional;

/**
 * schemaVersion N → N+1 한 단계.
 * 결과가 비어 있으면 이번 패스에서는 버전을 올리지 않는다.
 */
public interface JobDataMigration {

    int fromVersion();

    /**
     * @param job  브로커에 저장된 작업 (옵션 조회용, 변경하지 않는다)
     * @param data 현재 페이로드 사본
     */
    Optional<ObjectNode> migrate(BrokerJob job, ObjectNode data);
}
