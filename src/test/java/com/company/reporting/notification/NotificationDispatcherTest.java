package com.company.reporting.notification;

import com.company.reporting.domain.NotificationChannelDescriptor;
import com.company.reporting.domain.enums.ChannelType;
import com.company.reporting.exception.NotificationSendException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationDispatcherTest {

    @Mock
    private NotificationChannel emailChannel;

    @Mock
    private NotificationChannel slackChannel;

    private SimpleMeterRegistry meterRegistry;
    private NotificationDispatcher dispatcher;

    private final AlertNotification notification = AlertNotification.builder()
            .ruleId(5L)
            .ruleName("CPU")
            .severity("high")
            .value(150.0)
            .threshold(100.0)
            .operator(">")
            .message("Alert CPU: 150.0 > 100.0")
            .build();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(emailChannel.getType()).thenReturn(ChannelType.EMAIL);
        when(slackChannel.getType()).thenReturn(ChannelType.SLACK);
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new NotificationDispatcher(List.of(emailChannel, slackChannel),
                OpenTelemetry.noop().getTracer("test"), meterRegistry);
    }

    @Test
    void dispatch_failingChannel_doesNotBlockOthers() {
        NotificationChannelDescriptor email = descriptor("email", Map.of("to", "ops@example.com"));
        NotificationChannelDescriptor slack = descriptor("slack", Map.of("webhook_url", "https://hooks.example.com/x"));
        doThrow(new NotificationSendException("smtp down")).when(emailChannel).send(email, notification);

        int delivered = dispatcher.dispatch(List.of(email, slack), notification);

        assertThat(delivered).isEqualTo(1);
        verify(slackChannel).send(slack, notification);
        assertThat(meterRegistry.counter("notifications.failed", "channel", "email").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("notifications.sent", "channel", "slack").count()).isEqualTo(1.0);
    }

    @Test
    void dispatch_unsupportedChannel_skippedAndCounted() {
        int delivered = dispatcher.dispatch(List.of(descriptor("pagerduty", Map.of())), notification);

        assertThat(delivered).isZero();
        verify(emailChannel, never()).send(any(), any());
        verify(slackChannel, never()).send(any(), any());
        assertThat(meterRegistry.counter("notifications.failed", "channel", "unsupported").count()).isEqualTo(1.0);
    }

    @Test
    void dispatch_noChannels_returnsZero() {
        assertThat(dispatcher.dispatch(List.of(), notification)).isZero();
        assertThat(dispatcher.dispatch(null, notification)).isZero();
    }

    @Test
    void dispatch_webhookWithoutRegisteredChannel_counted() {
        int delivered = dispatcher.dispatch(List.of(descriptor("webhook", Map.of("url", "http://x"))), notification);

        assertThat(delivered).isZero();
    }

    private NotificationChannelDescriptor descriptor(String type, Map<String, Object> config) {
        return NotificationChannelDescriptor.builder().type(type).config(config).build();
    }
}
