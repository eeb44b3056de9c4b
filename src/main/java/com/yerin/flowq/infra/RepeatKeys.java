package com.yerin.flowq.infra;

import com.yerin.flowq.domain.RepeatOptions;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * 반복 스케줄 키와 실행분 jobId 규칙.
 * <pre>
 * repeatKey  = name:jobId::tz:pattern        (endDate 자리는 비어 있음)
 * instanceId = repeat:md5(repeatKey):nextMillis
 * </pre>
 */
public final class RepeatKeys {
    private RepeatKeys() {}

    public static String repeatKey(String name, String jobId, RepeatOptions repeat) {
        return name + ":" + (jobId == null ? "" : jobId) + "::" + repeat.tz() + ":" + repeat.pattern();
    }

    public static String instanceIdPrefix(String repeatKey) {
        return "repeat:" + DigestUtils.md5DigestAsHex(repeatKey.getBytes(StandardCharsets.UTF_8)) + ":";
    }

    public static String instanceId(String repeatKey, long nextMillis) {
        return instanceIdPrefix(repeatKey) + nextMillis;
    }
}
