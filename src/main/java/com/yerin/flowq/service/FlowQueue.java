package com.yerin.flowq.service;

import com.yerin.flowq.domain.AddParams;
import com.yerin.flowq.domain.QueueManager;
import com.yerin.flowq.domain.QueueMode;
import com.yerin.flowq.domain.RemoveParams;
import com.yerin.flowq.global.exception.AppException;
import com.yerin.flowq.global.exception.code.QueueErrorCode;
import lombok.extern.slf4j.Slf4j;

/**
 * 호출자가 보는 유일한 큐 진입점. 백엔드는 프로세스 시작 시 정해지고 바뀌지 않는다.
 */
@Slf4j
public class FlowQueue implements QueueManager {

    private final QueueMode mode;
    private final QueueManager delegate;
    private volatile boolean initialized;

    public FlowQueue(QueueMode mode, QueueManager delegate) {
        this.mode = mode;
        this.delegate = delegate;
    }

    @Override
    public void init() {
        log.info("[FlowQueue] init mode={}", mode);
        delegate.init();
        initialized = true;
    }

    @Override
    public void add(AddParams params) {
        ensureInitialized();
        delegate.add(params);
    }

    @Override
    public void removeRepeatingJob(RemoveParams params) {
        ensureInitialized();
        delegate.removeRepeatingJob(params);
    }

    public QueueMode mode() {
        return mode;
    }

    public boolean isInitialized() {
        return initialized;
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new AppException(QueueErrorCode.QUEUE_NOT_INITIALIZED);
        }
    }
}
