package com.yerin.coursenotify.infra;

import com.yerin.coursenotify.domain.JobQueuePort;
import com.yerin.coursenotify.domain.NotificationJobType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisStreamsQueueAdapter implements JobQueuePort {
    static final String BOOTSTRAP_FIELD = "bootstrap";

    private final StringRedisTemplate redis;

    @Value("${notify.stream.key:notify:stream:notifications}")
    private String streamKey;

    @Value("${notify.stream.group:notify:cg}")
    private String groupName;

    // 처리된 레코드는 워커가 지우므로 이 상한은 적체 시에만 닿는다. 잘린 작업은 DueJobPromoter가 다시 발행
    @Value("${notify.stream.maxLength:10000}")
    private long maxLength;

    private volatile boolean grouped = false;

    @Override
    public void publish(NotificationJobType type, Long jobId) {
        ensureGroup();

        Map<String, String> fields = new HashMap<>();
        fields.put("type", type.getCode());
        fields.put("jobId", String.valueOf(jobId));
        fields.put("publishedAt", Instant.now().toString());

        RecordId rid = redis.opsForStream().add(StreamRecords.mapBacked(fields).withStreamKey(streamKey));
        redis.opsForStream().trim(streamKey, maxLength, true);
        log.info("[RedisStream] XADD key={}, id={}, jobId={}, type={}", streamKey, rid, jobId, type.getCode());
    }

    /**
     * Removes a record the group has acknowledged.
     */
    public void remove(RecordId id) {
        redis.opsForStream().delete(streamKey, id);
    }

    @Override
    public long backlog() {
        Long size = redis.opsForStream().size(streamKey);
        return size == null ? 0 : size;
    }

    public String streamKey() {
        return streamKey;
    }

    public String groupName() {
        return groupName;
    }

    /**
     * Forgets the prepared group so the next call recreates it, e.g. after Redis lost its data.
     */
    public void groupLost() {
        grouped = false;
    }

    // 스트림이 없으면 그룹 생성이 실패하므로 부트스트랩 레코드로 스트림을 먼저 만든다.
    // 그룹이 실제로 준비됐을 때만 grouped를 세워, Redis 장애 중 실패하면 다음 호출에서 다시 시도한다
    public void ensureGroup() {
        if (grouped) return;
        synchronized (this) {
            if (grouped) return;
            RecordId bootstrap = null;
            try {
                bootstrap = redis.opsForStream().add(
                        StreamRecords.mapBacked(Map.of(BOOTSTRAP_FIELD, "1")).withStreamKey(streamKey));
                redis.opsForStream().createGroup(streamKey, ReadOffset.from("0-0"), groupName);
                grouped = true;
                log.info("[RedisStream] group prepared key={}, group={}", streamKey, groupName);
            } catch (RuntimeException e) {
                if (isBusyGroup(e)) {
                    grouped = true;
                    log.debug("[RedisStream] group already exists key={}, group={}", streamKey, groupName);
                } else {
                    log.warn("[RedisStream] group not ready key={}, group={}, retry on next call: {}",
                            streamKey, groupName, e.toString());
                }
            } finally {
                if (bootstrap != null) {
                    deleteBootstrap(bootstrap);
                }
            }
        }
    }

    private void deleteBootstrap(RecordId bootstrap) {
        try {
            redis.opsForStream().delete(streamKey, bootstrap);
        } catch (RuntimeException e) {
            // 남아도 워커가 bootstrap 필드를 보고 건너뛴다
            log.warn("[RedisStream] bootstrap record not deleted key={}, id={}: {}", streamKey, bootstrap, e.toString());
        }
    }

    static boolean isBusyGroup(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg != null && (msg.contains("BUSYGROUP") || msg.contains("already exists"))) {
                return true;
            }
        }
        return false;
    }

    static boolean isNoGroup(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg != null && msg.contains("NOGROUP")) {
                return true;
            }
        }
        return false;
    }
}
