package com.yerin.coursenotify.application;

import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.payload.NotificationPayload;

/**
 * Executes one job kind. Throwing fails the attempt; returning normally completes the job,
 * including the case where the handler decided nothing needed to be sent.
 */
public interface NotificationJobHandler<P extends NotificationPayload> {
    NotificationJobType type();

    Class<P> payloadType();

    void handle(Long jobId, P payload);
}
