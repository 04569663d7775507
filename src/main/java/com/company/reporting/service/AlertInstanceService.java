package com.company.reporting.service;

import com.company.reporting.domain.AlertInstance;
import com.company.reporting.domain.enums.AlertInstanceStatus;
import com.company.reporting.exception.ResourceNotFoundException;
import com.company.reporting.repository.AlertInstanceRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Manual lifecycle of alert instances: ACTIVE, then ACKNOWLEDGED, then RESOLVED.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertInstanceService {

    private final AlertInstanceRepository instanceRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public AlertInstance acknowledge(Long instanceId, String userId) {
        AlertInstance instance = find(instanceId);

        if (instance.getStatus() != AlertInstanceStatus.ACTIVE) {
            throw new IllegalStateException("Alert instance " + instanceId + " is "
                    + instance.getStatus().toValue() + " and cannot be acknowledged");
        }

        instance.setStatus(AlertInstanceStatus.ACKNOWLEDGED);
        instance.setAcknowledgedAt(clock.instant());
        instance.setAcknowledgedBy(userId);
        instanceRepository.updateStatus(instance);

        meterRegistry.counter("alerts.instances.acknowledged").increment();
        log.info("Alert instance {} acknowledged by {}", instanceId, userId);
        return instance;
    }

    @Transactional
    public AlertInstance resolve(Long instanceId, String userId, String reason) {
        AlertInstance instance = find(instanceId);

        if (instance.getStatus() == AlertInstanceStatus.RESOLVED) {
            throw new IllegalStateException("Alert instance " + instanceId + " is already resolved");
        }

        instance.setStatus(AlertInstanceStatus.RESOLVED);
        instance.setResolvedAt(clock.instant());
        instance.setResolvedBy(userId);
        instance.setResolutionReason(reason);
        instance.setAutoResolved(false);
        instanceRepository.updateStatus(instance);

        meterRegistry.counter("alerts.instances.resolved").increment();
        log.info("Alert instance {} resolved by {}", instanceId, userId);
        return instance;
    }

    private AlertInstance find(Long instanceId) {
        return instanceRepository.findById(instanceId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert instance", instanceId));
    }
}
