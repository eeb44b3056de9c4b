package com.yerin.flowq.domain;

public enum JobType {
    ONE_TIME,
    DELAYED,
    REPEATING
}
