package com.yerin.flowq.domain.data;

public enum ExecutionType {
    BEGIN,
    RESUME
}
