package com.yerin.coursenotify.notification;

import com.yerin.coursenotify.config.NotifyMailProperties;
import com.yerin.coursenotify.global.exception.AppException;
import com.yerin.coursenotify.global.exception.code.NotificationErrorCode;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notify.mail.enabled", havingValue = "true")
public class SmtpNotificationDispatcher implements NotificationDispatcher {

    private final JavaMailSender mailSender;
    private final EmailTemplates templates;
    private final NotifyMailProperties mailProperties;

    @Override
    public void send(NotificationKind kind, List<Recipient> recipients, Map<String, Object> templateData) {
        if (recipients.isEmpty()) {
            throw new IllegalArgumentException("no recipients for " + kind);
        }
        RenderedEmail email = templates.render(kind, recipients, templateData);
        String[] to = recipients.stream().map(Recipient::email).toArray(String[]::new);

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(mailProperties.from());
            helper.setTo(to);
            helper.setSubject(email.subject());
            helper.setText(email.html(), true);
            mailSender.send(message);
        } catch (MessagingException e) {
            throw new AppException(NotificationErrorCode.DELIVERY_FAILED, e);
        }
        log.info("[Mail] sent kind={}, to={}", kind, String.join(", ", to));
    }
}
