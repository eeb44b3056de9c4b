package com.yerin.flowq.infra;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.util.UUID;

public final class WorkerId {
    private static final String PROCESS = resolveProcess();

    private WorkerId() {}

    /** host-pid */
    public static String processName() {
        return PROCESS;
    }

    /** 워커 스레드/락 소유자를 구분하는 고유 토큰 */
    public static String newToken() {
        return PROCESS + "-" + UUID.randomUUID();
    }

    private static String resolveProcess() {
        String pid = ManagementFactory.getRuntimeMXBean().getName().split("@")[0];
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + pid;
        } catch (Exception e) {
            return "worker-" + pid;
        }
    }
}
