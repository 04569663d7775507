package com.company.reporting.notification;

import com.company.reporting.domain.NotificationChannelDescriptor;
import com.company.reporting.domain.enums.ChannelType;
import com.company.reporting.exception.NotificationSendException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts to a Slack incoming webhook.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SlackNotificationChannel implements NotificationChannel {

    private static final Map<String, String> SEVERITY_COLORS = Map.of(
            "low", "#36a64f",
            "medium", "#ffcc00",
            "high", "#ff9900",
            "critical", "#ff0000");

    private final RestTemplate restTemplate;

    @Override
    public ChannelType getType() {
        return ChannelType.SLACK;
    }

    @Override
    @Retry(name = "notificationWebhook", fallbackMethod = "sendFallback")
    public void send(NotificationChannelDescriptor descriptor, AlertNotification notification) {
        String webhookUrl = descriptor.configString("webhook_url");
        if (webhookUrl == null) {
            throw new NotificationSendException("Slack channel has no webhook_url");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        restTemplate.postForEntity(webhookUrl, new HttpEntity<>(buildMessage(descriptor, notification), headers), String.class);
        log.info("Slack notification sent for rule {}", notification.getRuleId());
    }

    Map<String, Object> buildMessage(NotificationChannelDescriptor descriptor, AlertNotification notification) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", SEVERITY_COLORS.getOrDefault(notification.getSeverity(), "#cccccc"));
        attachment.put("title", notification.getRuleName());
        attachment.put("text", notification.getMessage());
        attachment.put("fields", List.of(
                Map.of("title", "Severity", "value", String.valueOf(notification.getSeverity()), "short", true),
                Map.of("title", "Value", "value", String.valueOf(notification.getValue()), "short", true)));

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("text", ":rotating_light: " + notification.getMessage());
        if (descriptor.configString("channel") != null) {
            message.put("channel", descriptor.configString("channel"));
        }
        message.put("attachments", List.of(attachment));
        return message;
    }

    private void sendFallback(NotificationChannelDescriptor descriptor, AlertNotification notification, Exception e) {
        log.error("Slack delivery failed for rule {} after retries: {}", notification.getRuleId(), e.getMessage());
        throw new NotificationSendException("Slack delivery failed", e);
    }
}
