package com.stakeledger.backend.service;

import com.stakeledger.backend.config.LedgerProperties;
import com.stakeledger.backend.dto.SolvencyReport;
import com.stakeledger.backend.entity.LedgerState;
import com.stakeledger.backend.repository.ParticipantStakeRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SolvencyServiceTest {

    private LedgerStateService ledgerStateService;
    private ParticipantStakeRepository participantStakeRepository;
    private AuditEventService auditEventService;
    private MetricsService metricsService;
    private LedgerProperties ledgerProperties;
    private SolvencyService solvencyService;

    @BeforeEach
    void setUp() {
        ledgerStateService = mock(LedgerStateService.class);
        participantStakeRepository = mock(ParticipantStakeRepository.class);
        auditEventService = mock(AuditEventService.class);
        metricsService = new MetricsService(new SimpleMeterRegistry());
        ledgerProperties = new LedgerProperties();
        solvencyService = new SolvencyService(ledgerStateService, participantStakeRepository, auditEventService,
                metricsService, ledgerProperties, Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void balancedLedgerPassesQuietly() {
        givenState(500, 100);
        when(participantStakeRepository.sumStakedAmount()).thenReturn(400L);

        solvencyService.reconcile();

        assertThat(metricsService.solvencyMismatchCount()).isZero();
        verify(auditEventService, never()).recordEvent(anyString(), any(), any(), any(), any());
    }

    @Test
    void shortfallIsReportedAndAudited() {
        givenState(300, 100);
        when(participantStakeRepository.sumStakedAmount()).thenReturn(400L);

        SolvencyReport report = solvencyService.checkSolvency();
        solvencyService.reconcile();

        assertThat(report.solvent()).isFalse();
        assertThat(report.surplus()).isEqualTo(-200);
        assertThat(metricsService.solvencyMismatchCount()).isEqualTo(1);
        verify(auditEventService).recordEvent(eq("SOLVENCY_MISMATCH"), isNull(), eq(-200L),
                eq("Custody below obligations"), any());
    }

    @Test
    void disabledReconciliationSkipsCheck() {
        ledgerProperties.getReconciliation().setEnabled(false);

        solvencyService.reconcile();

        verify(ledgerStateService, never()).requireInitialized();
    }

    private void givenState(long heldBalance, long confiscatedTotal) {
        LedgerState state = LedgerState.builder()
                .id(1L)
                .initialized(true)
                .heldBalance(heldBalance)
                .confiscatedTotal(confiscatedTotal)
                .build();
        when(ledgerStateService.isInitialized()).thenReturn(true);
        when(ledgerStateService.requireInitialized()).thenReturn(state);
    }
}
