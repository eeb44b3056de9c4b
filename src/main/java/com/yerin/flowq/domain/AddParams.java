package com.yerin.flowq.domain;

import com.yerin.flowq.domain.data.JobData;

import java.util.Objects;

/**
 * add 요청. 작업 종류별로 스케줄링 필드가 다르다.
 */
public interface AddParams {

    String id();

    JobData data();

    JobType type();

    record OneTime(String id, JobData data, JobPriority priority) implements AddParams {
        public OneTime {
            requireIdAndData(id, data);
            if (priority == null) priority = JobPriority.NORMAL;
        }

        @Override
        public JobType type() {
            return JobType.ONE_TIME;
        }
    }

    record Delayed(String id, JobData data, long delayMs) implements AddParams {
        public Delayed {
            requireIdAndData(id, data);
            if (delayMs < 0) {
                throw new IllegalArgumentException("delayMs must be >= 0 but was " + delayMs);
            }
        }

        @Override
        public JobType type() {
            return JobType.DELAYED;
        }
    }

    record Repeating(String id, JobData data, String cronExpression, String timezone) implements AddParams {
        public Repeating {
            requireIdAndData(id, data);
            // 잘못된 cron / 타임존은 여기서 바로 거부
            new RepeatOptions(cronExpression, timezone);
        }

        public RepeatOptions repeatOptions() {
            return new RepeatOptions(cronExpression, timezone);
        }

        @Override
        public JobType type() {
            return JobType.REPEATING;
        }
    }

    private static void requireIdAndData(String id, JobData data) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(data, "data");
    }
}
