package com.company.reporting.notification;

import com.company.reporting.domain.NotificationChannelDescriptor;
import com.company.reporting.domain.enums.ChannelType;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fans an alert out to its configured channels. Each channel is attempted
 * independently; one failing channel never blocks the rest.
 */
@Component
@Slf4j
public class NotificationDispatcher {

    private final Map<ChannelType, NotificationChannel> channels = new EnumMap<>(ChannelType.class);
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    public NotificationDispatcher(List<NotificationChannel> channels, Tracer tracer, MeterRegistry meterRegistry) {
        channels.forEach(channel -> this.channels.put(channel.getType(), channel));
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @return number of channels that accepted the notification
     */
    public int dispatch(List<NotificationChannelDescriptor> descriptors, AlertNotification notification) {
        if (descriptors == null || descriptors.isEmpty()) {
            log.debug("Alert rule {} has no notification channels", notification.getRuleId());
            return 0;
        }

        int delivered = 0;
        for (NotificationChannelDescriptor descriptor : descriptors) {
            if (deliver(descriptor, notification)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(NotificationChannelDescriptor descriptor, AlertNotification notification) {
        ChannelType type = descriptor.channelType();
        NotificationChannel channel = channels.get(type);
        if (channel == null) {
            log.warn("Skipping unsupported notification channel '{}' for rule {}",
                    descriptor.getType(), notification.getRuleId());
            meterRegistry.counter("notifications.failed", "channel", "unsupported").increment();
            return false;
        }

        String channelTag = type.name().toLowerCase();
        Span span = tracer.spanBuilder("alert.notification")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("alert.rule.id", notification.getRuleId() != null ? notification.getRuleId() : -1L);
            span.setAttribute("notification.channel", channelTag);
            span.setAttribute("severity", String.valueOf(notification.getSeverity()));

            channel.send(descriptor, notification);

            meterRegistry.counter("notifications.sent", "channel", channelTag).increment();
            return true;
        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Notification delivery failed");
            log.error("Failed to deliver {} notification for rule {}", channelTag, notification.getRuleId(), e);
            meterRegistry.counter("notifications.failed", "channel", channelTag).increment();
            return false;
        } finally {
            span.end();
        }
    }
}
