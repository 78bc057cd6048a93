package com.yerin.coursenotify.application;

import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.payload.NotificationPayload;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

@Component
public class JobHandlerRegistry {
    private final Map<NotificationJobType, BiConsumer<Long, NotificationPayload>> map = new EnumMap<>(NotificationJobType.class);
    private final Map<NotificationJobType, String> owners = new EnumMap<>(NotificationJobType.class);

    public JobHandlerRegistry(List<NotificationJobHandler<?>> handlers) {
        for (NotificationJobHandler<?> h : handlers) {
            if (!h.type().getPayloadType().equals(h.payloadType())) {
                throw new IllegalStateException(h.getClass().getSimpleName() + " handles "
                        + h.payloadType().getSimpleName() + " but " + h.type() + " carries "
                        + h.type().getPayloadType().getSimpleName());
            }
            String prev = owners.put(h.type(), h.getClass().getSimpleName());
            if (prev != null) {
                throw new IllegalStateException("duplicate handler for " + h.type()
                        + ": " + prev + ", " + h.getClass().getSimpleName());
            }
            map.put(h.type(), adapt(h));
        }
        Set<NotificationJobType> missing = EnumSet.allOf(NotificationJobType.class);
        missing.removeAll(map.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("no handler registered for " + missing);
        }
    }

    public void dispatch(Long jobId, NotificationJobType type, NotificationPayload payload) {
        map.get(type).accept(jobId, payload);
    }

    // 핸들러의 페이로드 타입으로 검사 후 전달
    private static <P extends NotificationPayload> BiConsumer<Long, NotificationPayload> adapt(NotificationJobHandler<P> h) {
        Class<P> payloadType = h.payloadType();
        return (jobId, payload) -> h.handle(jobId, payloadType.cast(payload));
    }
}
