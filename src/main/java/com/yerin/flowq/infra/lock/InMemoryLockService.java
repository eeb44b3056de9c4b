package com.yerin.flowq.infra.lock;

import com.yerin.flowq.global.exception.LockAcquisitionException;
import com.yerin.flowq.infra.WorkerId;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

@Slf4j
public class InMemoryLockService implements LockService {

    private final Map<String, Semaphore> locks = new ConcurrentHashMap<>();
    private final Map<String, String> owners = new ConcurrentHashMap<>();

    @Override
    public LockHandle acquire(String key, Duration timeout) {
        Semaphore semaphore = locks.computeIfAbsent(key, k -> new Semaphore(1));
        try {
            if (!semaphore.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(key, timeout);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key, ie);
        }
        String token = WorkerId.newToken();
        owners.put(key, token);
        return new LockHandle(key, token);
    }

    @Override
    public void release(LockHandle handle) {
        if (!owners.remove(handle.key(), handle.token())) {
            log.warn("[Lock] release skipped, lock no longer owned key={}", handle.key());
            return;
        }
        locks.get(handle.key()).release();
    }
}
