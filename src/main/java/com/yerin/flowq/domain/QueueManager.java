package com.yerin.flowq.domain;

/**
 * 플로우 실행 큐의 공통 계약. 메모리/Redis 백엔드 모두 이 인터페이스만 노출한다.
 */
public interface QueueManager {

    /**
     * add / removeRepeatingJob 호출 전에 한 번 호출되어야 한다. 다시 호출해도 안전하다.
     */
    void init();

    void add(AddParams params);

    /**
     * 반복 작업 스케줄을 제거한다. 대상이 없으면 기록만 남기고 정상 반환한다.
     *
     * @throws com.yerin.flowq.global.exception.JobRemovalFailureException 키는 있었지만 브로커가 제거하지 못한 경우
     */
    void removeRepeatingJob(RemoveParams params);
}
