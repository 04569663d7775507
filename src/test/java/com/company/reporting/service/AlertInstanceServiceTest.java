package com.company.reporting.service;

import com.company.reporting.domain.AlertInstance;
import com.company.reporting.domain.enums.AlertInstanceStatus;
import com.company.reporting.exception.ResourceNotFoundException;
import com.company.reporting.repository.AlertInstanceRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AlertInstanceServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private AlertInstanceRepository instanceRepository;

    private AlertInstanceService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new AlertInstanceService(instanceRepository, new SimpleMeterRegistry(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void acknowledge_active_recordsUserAndTime() {
        AlertInstance instance = instance(AlertInstanceStatus.ACTIVE);
        when(instanceRepository.findById(11L)).thenReturn(Optional.of(instance));

        AlertInstance acknowledged = service.acknowledge(11L, "oncall-1");

        assertThat(acknowledged.getStatus()).isEqualTo(AlertInstanceStatus.ACKNOWLEDGED);
        assertThat(acknowledged.getAcknowledgedBy()).isEqualTo("oncall-1");
        assertThat(acknowledged.getAcknowledgedAt()).isEqualTo(NOW);
        verify(instanceRepository).updateStatus(instance);
    }

    @Test
    void acknowledge_notActive_rejected() {
        when(instanceRepository.findById(11L)).thenReturn(Optional.of(instance(AlertInstanceStatus.RESOLVED)));

        assertThatThrownBy(() -> service.acknowledge(11L, "oncall-1"))
                .isInstanceOf(IllegalStateException.class);
        verify(instanceRepository, never()).updateStatus(any());
    }

    @Test
    void resolve_acknowledged_closesManually() {
        AlertInstance instance = instance(AlertInstanceStatus.ACKNOWLEDGED);
        when(instanceRepository.findById(11L)).thenReturn(Optional.of(instance));

        AlertInstance resolved = service.resolve(11L, "oncall-1", "disk cleaned");

        assertThat(resolved.getStatus()).isEqualTo(AlertInstanceStatus.RESOLVED);
        assertThat(resolved.getResolvedAt()).isEqualTo(NOW);
        assertThat(resolved.getResolutionReason()).isEqualTo("disk cleaned");
        assertThat(resolved.getAutoResolved()).isFalse();
    }

    @Test
    void resolve_activeSkippingAcknowledge_allowed() {
        when(instanceRepository.findById(11L)).thenReturn(Optional.of(instance(AlertInstanceStatus.ACTIVE)));

        assertThat(service.resolve(11L, "oncall-1", null).getStatus()).isEqualTo(AlertInstanceStatus.RESOLVED);
    }

    @Test
    void resolve_alreadyResolved_rejected() {
        when(instanceRepository.findById(11L)).thenReturn(Optional.of(instance(AlertInstanceStatus.RESOLVED)));

        assertThatThrownBy(() -> service.resolve(11L, "oncall-1", "again"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already resolved");
    }

    @Test
    void acknowledge_unknownInstance_notFound() {
        when(instanceRepository.findById(12L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.acknowledge(12L, "oncall-1"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private AlertInstance instance(AlertInstanceStatus status) {
        return AlertInstance.builder().id(11L).alertRuleId(7L).status(status).build();
    }
}
