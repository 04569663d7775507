package com.company.reporting.notification;

import com.company.reporting.domain.NotificationChannelDescriptor;
import com.company.reporting.domain.enums.ChannelType;

/**
 * Delivers an alert to one kind of destination. Failures are signalled with
 * {@link com.company.reporting.exception.NotificationSendException}.
 */
public interface NotificationChannel {

    ChannelType getType();

    void send(NotificationChannelDescriptor descriptor, AlertNotification notification);
}
