package com.yerin.submitflow.infra;

import java.net.InetAddress;
import java.util.UUID;

public final class WorkerId {
    private static final String PROCESS = resolveProcess();

    private WorkerId() {}

    // 프로세스 단위 식별자: host-pid-랜덤
    public static String current() {
        return PROCESS;
    }

    public static String consumerName() {
        return PROCESS + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static String resolveProcess() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        long pid = ProcessHandle.current().pid();
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + pid + "-" + suffix;
        } catch (Exception e) {
            return "worker-" + pid + "-" + suffix;
        }
    }
}
