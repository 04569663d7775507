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

import java.util.Map;

/**
 * POSTs the alert as JSON to a configured URL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookNotificationChannel implements NotificationChannel {

    private final RestTemplate restTemplate;

    @Override
    public ChannelType getType() {
        return ChannelType.WEBHOOK;
    }

    @Override
    @Retry(name = "notificationWebhook", fallbackMethod = "sendFallback")
    public void send(NotificationChannelDescriptor descriptor, AlertNotification notification) {
        String url = descriptor.configString("url");
        if (url == null) {
            throw new NotificationSendException("Webhook channel has no url");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Object extraHeaders = descriptor.getConfig().get("headers");
        if (extraHeaders instanceof Map<?, ?> headerMap) {
            headerMap.forEach((name, value) -> headers.add(String.valueOf(name), String.valueOf(value)));
        }

        restTemplate.postForEntity(url, new HttpEntity<>(notification.toPayload(), headers), String.class);
        log.info("Webhook notification sent for rule {}", notification.getRuleId());
    }

    private void sendFallback(NotificationChannelDescriptor descriptor, AlertNotification notification, Exception e) {
        log.error("Webhook delivery failed for rule {} after retries: {}", notification.getRuleId(), e.getMessage());
        throw new NotificationSendException("Webhook delivery failed", e);
    }
}
