package com.yerin.flowq.domain.data;

public enum RepeatableJobType {
    EXECUTE_TRIGGER,
    DELAYED_FLOW;

    public static RepeatableJobType fromExecutionType(ExecutionType executionType) {
        if (executionType == ExecutionType.BEGIN) return EXECUTE_TRIGGER;
        if (executionType == ExecutionType.RESUME) return DELAYED_FLOW;
        return null;
    }
}
