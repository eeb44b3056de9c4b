package com.yerin.flowq.domain;

public enum ScheduleType {
    CRON_EXPRESSION
}
