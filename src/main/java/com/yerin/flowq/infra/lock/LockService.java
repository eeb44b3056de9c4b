package com.yerin.flowq.infra.lock;

import java.time.Duration;

/**
 * 문자열 키 단위의 상호 배제. 획득 대기와 보유 시간 모두 timeout 으로 제한된다.
 */
public interface LockService {

    /**
     * @throws com.yerin.flowq.global.exception.LockAcquisitionException timeout 안에 얻지 못한 경우
     */
    LockHandle acquire(String key, Duration timeout);

    void release(LockHandle handle);
}
