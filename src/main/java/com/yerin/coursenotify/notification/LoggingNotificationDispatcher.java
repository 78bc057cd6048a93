package com.yerin.coursenotify.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 실제 발송 없이 렌더링 결과만 로그로 남긴다 (local/test).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notify.mail.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private final EmailTemplates templates;

    @Override
    public void send(NotificationKind kind, List<Recipient> recipients, Map<String, Object> templateData) {
        RenderedEmail email = templates.render(kind, recipients, templateData);
        log.info("[Mail.simulated] kind={}, to={}, subject={}",
                kind, recipients.stream().map(Recipient::email).toList(), email.subject());
    }
}
