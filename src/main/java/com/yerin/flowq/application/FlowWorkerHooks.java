package com.yerin.flowq.application;

public interface FlowWorkerHooks {

    /**
     * 실행 직전 호출. false 면 실행하지 않고 작업을 완료 처리한다 (할당량 초과 등).
     */
    default boolean preExecute(String projectId, String runId) {
        return true;
    }
}
