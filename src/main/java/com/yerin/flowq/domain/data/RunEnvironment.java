package com.yerin.flowq.domain.data;

public enum RunEnvironment {
    PRODUCTION,
    TESTING
}
