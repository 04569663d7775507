package com.company.reporting.service;

import com.company.reporting.domain.AlertInstance;
import com.company.reporting.domain.AlertRule;
import com.company.reporting.domain.enums.AlertInstanceStatus;
import com.company.reporting.domain.enums.ComparisonOperator;
import com.company.reporting.domain.enums.Severity;
import com.company.reporting.event.AlertTriggeredEvent;
import com.company.reporting.repository.AlertInstanceRepository;
import com.company.reporting.repository.AlertRuleRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AlertEvaluationServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private AlertRuleRepository ruleRepository;

    @Mock
    private AlertInstanceRepository instanceRepository;

    @Mock
    private AlertMetricResolver metricResolver;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private AlertEvaluationService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        meterRegistry = new SimpleMeterRegistry();
        service = new AlertEvaluationService(ruleRepository, instanceRepository, metricResolver,
                eventPublisher, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
        when(instanceRepository.save(any())).thenAnswer(invocation -> {
            AlertInstance instance = invocation.getArgument(0);
            instance.setId(500L);
            return instance;
        });
    }

    @Test
    void evaluateRule_breach_createsActiveInstanceAndPublishes() {
        AlertRule rule = cpuRule();
        when(metricResolver.resolve(rule)).thenReturn(Optional.of(150.0));
        when(instanceRepository.findActiveByRuleId(7L)).thenReturn(Optional.empty());

        Optional<AlertInstance> created = service.evaluateRule(rule);

        assertThat(created).isPresent();
        AlertInstance instance = created.get();
        assertThat(instance.getStatus()).isEqualTo(AlertInstanceStatus.ACTIVE);
        assertThat(instance.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(instance.getTriggeredValue()).isEqualTo(150.0);
        assertThat(instance.getMessage()).isEqualTo("Alert CPU: 150.0 > 100.0");
        assertThat(instance.getTriggeredAt()).isEqualTo(NOW);

        ArgumentCaptor<AlertTriggeredEvent> event = ArgumentCaptor.forClass(AlertTriggeredEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getInstance().getId()).isEqualTo(500L);
        verify(ruleRepository).updateLastTriggeredAt(7L, NOW);
        verify(ruleRepository).updateLastEvaluatedAt(7L, NOW);
    }

    @Test
    void evaluateRule_sustainedBreach_singleInstanceAcrossTicks() {
        AlertRule rule = cpuRule();
        when(metricResolver.resolve(rule)).thenReturn(Optional.of(150.0));
        when(instanceRepository.findActiveByRuleId(7L))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(AlertInstance.builder().id(500L).status(AlertInstanceStatus.ACTIVE).build()));

        service.evaluateRule(rule);
        service.evaluateRule(rule);
        service.evaluateRule(rule);

        verify(instanceRepository, times(1)).save(any());
        verify(eventPublisher, times(1)).publishEvent(any(AlertTriggeredEvent.class));
        verify(ruleRepository, times(3)).updateLastEvaluatedAt(7L, NOW);
        assertThat(meterRegistry.counter("alerts.instances.deduplicated").count()).isEqualTo(2.0);
    }

    @Test
    void evaluateRule_belowThreshold_noInstance() {
        AlertRule rule = cpuRule();
        when(metricResolver.resolve(rule)).thenReturn(Optional.of(40.0));

        assertThat(service.evaluateRule(rule)).isEmpty();
        verify(instanceRepository, never()).save(any());
        verify(ruleRepository).updateLastEvaluatedAt(7L, NOW);
        assertThat(rule.getLastEvaluatedAt()).isEqualTo(NOW);
    }

    @Test
    void evaluateRule_fetchFails_skippedWithoutTouchingRule() {
        AlertRule rule = cpuRule();
        when(metricResolver.resolve(rule)).thenThrow(new IllegalStateException("timeout"));

        assertThat(service.evaluateRule(rule)).isEmpty();
        verify(ruleRepository, never()).updateLastEvaluatedAt(any(), any());
        assertThat(meterRegistry.counter("alerts.evaluation.failures").count()).isEqualTo(1.0);
    }

    @Test
    void evaluateRule_noValue_skipped() {
        AlertRule rule = cpuRule();
        when(metricResolver.resolve(rule)).thenReturn(Optional.empty());

        assertThat(service.evaluateRule(rule)).isEmpty();
        verify(ruleRepository, never()).updateLastEvaluatedAt(any(), any());
    }

    @Test
    void evaluateRule_concurrentInsert_treatedAsDuplicate() {
        AlertRule rule = cpuRule();
        when(metricResolver.resolve(rule)).thenReturn(Optional.of(150.0));
        when(instanceRepository.findActiveByRuleId(7L)).thenReturn(Optional.empty());
        doThrow(new DuplicateKeyException("uq_alert_instances_active")).when(instanceRepository).save(any());

        assertThat(service.evaluateRule(rule)).isEmpty();
        verify(eventPublisher, never()).publishEvent(any(AlertTriggeredEvent.class));
        verify(ruleRepository, never()).updateLastTriggeredAt(any(), any());
        verify(ruleRepository).updateLastEvaluatedAt(7L, NOW);
    }

    @Test
    void evaluateRule_unknownOperator_neverTriggers() {
        AlertRule rule = cpuRule();
        rule.setComparisonOperator(ComparisonOperator.UNKNOWN);
        when(metricResolver.resolve(rule)).thenReturn(Optional.of(1_000_000.0));

        assertThat(service.evaluateRule(rule)).isEmpty();
        verify(instanceRepository, never()).findActiveByRuleId(any());
    }

    @Test
    void evaluateAll_oneRuleThrows_othersStillEvaluated() {
        AlertRule broken = cpuRule();
        broken.setId(1L);
        AlertRule healthy = cpuRule();
        healthy.setId(2L);
        when(ruleRepository.findAllEnabled()).thenReturn(List.of(broken, healthy));
        when(metricResolver.resolve(broken)).thenReturn(Optional.of(150.0));
        when(metricResolver.resolve(healthy)).thenReturn(Optional.of(150.0));
        when(instanceRepository.findActiveByRuleId(1L)).thenThrow(new IllegalStateException("db gone"));
        when(instanceRepository.findActiveByRuleId(2L)).thenReturn(Optional.empty());

        int created = service.evaluateAll();

        assertThat(created).isEqualTo(1);
        verify(ruleRepository).updateLastTriggeredAt(2L, NOW);
    }

    private AlertRule cpuRule() {
        return AlertRule.builder()
                .id(7L)
                .tenantId("default")
                .name("CPU")
                .thresholdValue(100.0)
                .comparisonOperator(ComparisonOperator.GREATER_THAN)
                .severity(Severity.HIGH)
                .enabled(true)
                .build();
    }
}
