package com.yerin.coursenotify.notification;

import java.util.List;
import java.util.Map;

/**
 * Formats and transmits one notification. Implementations throw on transport failure.
 */
public interface NotificationDispatcher {
    void send(NotificationKind kind, List<Recipient> recipients, Map<String, Object> templateData);
}
