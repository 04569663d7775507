package com.company.reporting.notification;

import com.company.reporting.domain.NotificationChannelDescriptor;
import com.company.reporting.domain.enums.ChannelType;
import com.company.reporting.exception.NotificationSendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Component
@Slf4j
public class EmailNotificationChannel implements NotificationChannel {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final String fromAddress;

    public EmailNotificationChannel(ObjectProvider<JavaMailSender> mailSender,
                                    @Value("${reporting.notification.email.from:alerts@reporting.local}") String fromAddress) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.EMAIL;
    }

    @Override
    public void send(NotificationChannelDescriptor descriptor, AlertNotification notification) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new NotificationSendException("No mail sender configured (spring.mail.host)");
        }

        List<String> recipients = recipients(descriptor);
        if (recipients.isEmpty()) {
            throw new NotificationSendException("Email channel has no recipients");
        }

        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(fromAddress);
        mail.setTo(recipients.toArray(new String[0]));
        mail.setSubject("[" + notification.getSeverity() + "] " + notification.getRuleName());
        mail.setText(notification.getMessage() + "\n\nTriggered at: " + notification.getTriggeredAt());

        try {
            sender.send(mail);
        } catch (MailException e) {
            throw new NotificationSendException("Failed to send alert email", e);
        }

        log.info("Alert email sent for rule {} to {} recipient(s)", notification.getRuleId(), recipients.size());
    }

    private List<String> recipients(NotificationChannelDescriptor descriptor) {
        List<String> recipients = new ArrayList<>();
        Object configured = descriptor.getConfig() != null ? descriptor.getConfig().get("recipients") : null;
        if (configured instanceof Collection<?> values) {
            values.forEach(value -> recipients.add(String.valueOf(value)));
        } else if (descriptor.configString("to") != null) {
            recipients.add(descriptor.configString("to"));
        }
        return recipients;
    }
}
