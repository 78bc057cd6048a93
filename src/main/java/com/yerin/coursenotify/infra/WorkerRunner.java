package com.yerin.coursenotify.infra;

import com.yerin.coursenotify.service.NotificationJobProcessor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notify.worker.enabled", havingValue = "true", matchIfMissing = true)
public class WorkerRunner {
    private final StringRedisTemplate redis;
    private final RedisStreamsQueueAdapter streams;
    private final NotificationJobProcessor processor;

    @Value("${notify.worker.batchSize:10}")
    private long batchSize;

    @Value("${notify.worker.blockMillis:2000}")
    private long blockMillis;

    @Value("${notify.worker.concurrency:1}")
    private int concurrency;

    private ExecutorService workers;

    @PostConstruct
    void startWorkers() {
        streams.ensureGroup();

        workers = Executors.newFixedThreadPool(concurrency);
        for (int i = 0; i < concurrency; i++) {
            final String consumer = WorkerId.consumerName(i);
            workers.submit(() -> {
                while (!Thread.currentThread().isInterrupted()) {
                    try {
                        pollOnce(consumer);
                    } catch (Exception e) {
                        if (RedisStreamsQueueAdapter.isNoGroup(e)) {
                            streams.groupLost();
                        }
                        log.warn("[Worker] poll loop error: {}", e.toString());
                        try { Thread.sleep(100); } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                        }
                    }
                }
            });
        }
        log.info("[Worker] started {} consumers on stream={}", concurrency, streams.streamKey());
    }

    @PreDestroy
    void stopWorkers() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    public void pollOnce(String consumer) {
        streams.ensureGroup();
        final String key = streams.streamKey();

        List<MapRecord<String, Object, Object>> records = redis.opsForStream().read(
                Consumer.from(streams.groupName(), consumer),
                StreamReadOptions.empty().count(batchSize).block(Duration.ofMillis(blockMillis)),
                StreamOffset.create(key, ReadOffset.lastConsumed())
        );
        if (records == null || records.isEmpty()) return;

        for (MapRecord<String, Object, Object> rec : records) {
            Object jobIdField = rec.getValue().get("jobId");
            if (rec.getValue().containsKey(RedisStreamsQueueAdapter.BOOTSTRAP_FIELD) || jobIdField == null) {
                ack(key, rec);
                log.debug("[Worker] skip bootstrap/invalid rec id={}", rec.getId());
                continue;
            }

            final String typeCode = String.valueOf(rec.getValue().get("type"));
            try {
                processor.process(Long.valueOf(String.valueOf(jobIdField)), typeCode);
            } catch (NumberFormatException e) {
                log.warn("[Worker] invalid jobId={} rec id={}", jobIdField, rec.getId());
            } catch (Exception e) {
                // 저장소 장애 등: 작업은 WAITING으로 남고 DueJobPromoter가 다시 발행한다
                log.error("[Worker] processing error jobId={}, type={}", jobIdField, typeCode, e);
            } finally {
                ack(key, rec);
            }
        }
    }

    // 확인한 레코드는 스트림에서도 지운다 (작업 상태는 DB에 있다)
    private void ack(String key, MapRecord<String, Object, Object> rec) {
        redis.opsForStream().acknowledge(key, streams.groupName(), rec.getId());
        streams.remove(rec.getId());
    }
}
