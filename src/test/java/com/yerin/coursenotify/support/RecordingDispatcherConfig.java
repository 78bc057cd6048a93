package com.yerin.coursenotify.support;

import com.yerin.coursenotify.notification.NotificationDispatcher;
import com.yerin.coursenotify.notification.NotificationKind;
import com.yerin.coursenotify.notification.Recipient;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

@TestConfiguration
public class RecordingDispatcherConfig {

    public record Sent(NotificationKind kind, List<Recipient> recipients, Map<String, Object> data) {}

    public static class RecordingDispatcher implements NotificationDispatcher {
        private final List<Sent> sent = new CopyOnWriteArrayList<>();

        @Override
        public void send(NotificationKind kind, List<Recipient> recipients, Map<String, Object> templateData) {
            sent.add(new Sent(kind, List.copyOf(recipients), Map.copyOf(templateData)));
        }

        public List<Sent> sent(NotificationKind kind) {
            return sent.stream().filter(s -> s.kind() == kind).toList();
        }

        public void clear() {
            sent.clear();
        }
    }

    @Bean
    @Primary
    public RecordingDispatcher recordingDispatcher() {
        return new RecordingDispatcher();
    }
}
