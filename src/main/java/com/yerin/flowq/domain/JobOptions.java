package com.yerin.flowq.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * 브로커에 저장되는 작업 옵션. 지정하지 않은 값은 큐의 기본 옵션을 따른다.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobOptions(
        String jobId,
        Integer priority,
        Long delay,
        Integer attempts,
        BackoffOptions backoff,
        Boolean removeOnComplete,
        RepeatOptions repeat
) {

    public static final String EXPONENTIAL = "exponential";

    public static JobOptions defaults(int attempts, long backoffDelayMillis) {
        return JobOptions.builder()
                .attempts(attempts)
                .backoff(new BackoffOptions(EXPONENTIAL, backoffDelayMillis))
                .removeOnComplete(true)
                .build();
    }

    public int priorityOrDefault() {
        return priority == null ? 0 : priority;
    }

    public long delayOrZero() {
        return delay == null ? 0L : delay;
    }

    public int attemptsOrDefault() {
        return attempts == null ? 1 : attempts;
    }

    public long backoffDelayOrZero() {
        return backoff == null ? 0L : backoff.delay();
    }

    public boolean removeOnCompleteOrDefault() {
        return removeOnComplete == null || removeOnComplete;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BackoffOptions(String type, long delay) {}
}
