package com.yerin.flowq.infra.lock;

import com.yerin.flowq.global.exception.LockAcquisitionException;
import com.yerin.flowq.infra.WorkerId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.time.Duration;
import java.util.List;

/**
 * SET NX PX 기반 분산 락. 보유 시간은 timeout 과 같고, 해제는 토큰이 일치할 때만 한다.
 */
@Slf4j
public class RedisLockService implements LockService {

    private static final RedisScript<Long> RELEASE = releaseScript();

    private final StringRedisTemplate redis;
    private final String prefix;
    private final Duration retryInterval;

    public RedisLockService(StringRedisTemplate redis, String prefix, Duration retryInterval) {
        this.redis = redis;
        this.prefix = prefix;
        this.retryInterval = retryInterval;
    }

    private static RedisScript<Long> releaseScript() {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/releaseLock.lua")));
        script.setResultType(Long.class);
        return script;
    }

    String lockKey(String key) {
        return prefix + ":lock:" + key;
    }

    @Override
    public LockHandle acquire(String key, Duration timeout) {
        String token = WorkerId.newToken();
        long deadline = System.currentTimeMillis() + timeout.toMillis();

        while (true) {
            Boolean ok = redis.opsForValue().setIfAbsent(lockKey(key), token, timeout);
            if (Boolean.TRUE.equals(ok)) {
                log.debug("[Lock] acquired key={} token={}", key, token);
                return new LockHandle(key, token);
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new LockAcquisitionException(key, timeout);
            }
            try {
                Thread.sleep(retryInterval.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException(key, ie);
            }
        }
    }

    @Override
    public void release(LockHandle handle) {
        Long deleted = redis.execute(RELEASE, List.of(lockKey(handle.key())), handle.token());
        if (deleted == null || deleted == 0L) {
            // 보유 시간이 지나 다른 프로세스가 가져간 경우
            log.warn("[Lock] release skipped, lock no longer owned key={}", handle.key());
        }
    }
}
