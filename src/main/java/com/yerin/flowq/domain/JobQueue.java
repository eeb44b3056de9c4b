package com.yerin.flowq.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 이름 붙은 하나의 브로커 큐.
 * <p>
 * wait 집합은 (priority, 삽입 순서) 로 정렬되고, delayed 집합은 실행 예정 시각으로 정렬된다.
 * 반복 스케줄은 다음 실행분 하나만 delayed 작업으로 올라가 있다.
 */
public interface JobQueue {

    String name();

    /**
     * 같은 jobId 가 이미 있으면 아무것도 하지 않고 기존 레코드를 돌려준다.
     * repeat 옵션이 있으면 반복 스케줄을 등록하고 첫 실행분을 돌려준다.
     */
    BrokerJob add(String name, JsonNode data, JobOptions opts);

    Optional<BrokerJob> getJob(String jobId);

    /** wait, delayed, active, failed 상태의 모든 작업. */
    List<BrokerJob> getJobs();

    boolean updateData(String jobId, JsonNode data);

    List<RepeatableJob> getRepeatableJobs();

    /**
     * @return 등록된 반복 스케줄이 실제로 제거되었으면 true
     */
    boolean removeRepeatableByKey(String repeatJobKey);

    /** 실행 시각이 지난 delayed 작업을 wait 로 옮긴다. */
    int promoteDelayed(Instant now);

    /**
     * 우선순위가 가장 높은 작업을 active 로 옮긴다. 반복 실행분이면 다음 실행분을 예약한다.
     */
    Optional<BrokerJob> moveToActive(Instant now, Duration lease);

    boolean complete(BrokerJob job, Instant now);

    FailureOutcome fail(BrokerJob job, String reason, Instant retryAt, Instant now);

    /** lease 가 만료된 active 작업을 wait 로 되돌린다. */
    int reclaimStalled(Instant now);

    JobCounts counts();
}
