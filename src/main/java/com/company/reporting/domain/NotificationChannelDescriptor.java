package com.company.reporting.domain;

import com.company.reporting.domain.enums.ChannelType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One entry of an alert rule's notification config, e.g. {"type": "slack", "config": {...}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationChannelDescriptor {
    private String type;
    private Map<String, Object> config;

    public ChannelType channelType() {
        return ChannelType.fromString(type);
    }

    public String configString(String key) {
        if (config == null || config.get(key) == null) {
            return null;
        }
        return String.valueOf(config.get(key));
    }
}
