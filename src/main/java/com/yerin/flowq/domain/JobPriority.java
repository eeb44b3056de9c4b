package com.yerin.flowq.domain;

/**
 * ONE_TIME 작업의 우선순위. 브로커에서는 숫자가 작을수록 먼저 꺼내진다.
 */
public enum JobPriority {
    HIGH(1),
    NORMAL(2);

    private final int brokerValue;

    JobPriority(int brokerValue) {
        this.brokerValue = brokerValue;
    }

    public int brokerValue() {
        return brokerValue;
    }

    public static int brokerValueOf(JobPriority priority) {
        return priority == null ? NORMAL.brokerValue() : priority.brokerValue();
    }
}
