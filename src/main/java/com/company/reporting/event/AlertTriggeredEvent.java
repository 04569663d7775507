package com.company.reporting.event;

import com.company.reporting.domain.AlertInstance;
import com.company.reporting.domain.AlertRule;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AlertTriggeredEvent {
    private final AlertRule rule;
    private final AlertInstance instance;
}
