package com.yerin.coursenotify.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class WorkerId {
    private WorkerId() {}

    public static String consumerName(int index) {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "notify-worker";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8) + "-" + index;
    }
}
