package com.yerin.flowq.application;

public interface FlowRunHooks {

    default void onPreStart(String projectId) {
    }

    default void onFinish(String projectId, int taskCount) {
    }
}
