package com.yerin.flowq.infra;

import com.yerin.flowq.domain.JobOptions;

import java.time.Duration;

public final class Backoff {
    private Backoff() {}

    /**
     * attemptsMade 번째 실패 뒤의 대기 시간. 1 → base, 2 → base*2, 3 → base*4 ...
     */
    public static Duration exponential(int attemptsMade, long baseMillis) {
        long exp = Math.round(Math.pow(2, Math.max(0, attemptsMade - 1)) * baseMillis);
        return Duration.ofMillis(Math.max(0, exp));
    }

    public static Duration of(JobOptions.BackoffOptions backoff, int attemptsMade) {
        if (backoff == null) return Duration.ZERO;
        if ("fixed".equals(backoff.type())) return Duration.ofMillis(backoff.delay());
        return exponential(attemptsMade, backoff.delay());
    }
}
