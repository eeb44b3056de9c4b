package com.yerin.flowq.domain;

public enum QueueMode {
    MEMORY,
    REDIS
}
