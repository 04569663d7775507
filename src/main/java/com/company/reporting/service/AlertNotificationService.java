package com.company.reporting.service;

import com.company.reporting.event.AlertTriggeredEvent;
import com.company.reporting.notification.AlertNotification;
import com.company.reporting.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class AlertNotificationService {

    private final NotificationDispatcher dispatcher;

    @EventListener
    @Async
    public void onAlertTriggered(AlertTriggeredEvent event) {
        AlertNotification notification = AlertNotification.from(event.getRule(), event.getInstance());

        int delivered = dispatcher.dispatch(event.getRule().getNotificationConfig(), notification);

        log.info("Alert instance {} notified on {} channel(s)", event.getInstance().getId(), delivered);
    }
}
