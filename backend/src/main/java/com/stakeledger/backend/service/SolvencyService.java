package com.stakeledger.backend.service;

import com.stakeledger.backend.config.LedgerProperties;
import com.stakeledger.backend.dto.SolvencyReport;
import com.stakeledger.backend.entity.LedgerState;
import com.stakeledger.backend.repository.ParticipantStakeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;

/**
 * Reconciles custody against obligations: held value must cover every participant's stake
 * plus the confiscated pool.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SolvencyService {

    private final LedgerStateService ledgerStateService;
    private final ParticipantStakeRepository participantStakeRepository;
    private final AuditEventService auditEventService;
    private final MetricsService metricsService;
    private final LedgerProperties ledgerProperties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public SolvencyReport checkSolvency() {
        LedgerState state = ledgerStateService.requireInitialized();
        long totalStaked = participantStakeRepository.sumStakedAmount();
        long owed = Math.addExact(totalStaked, state.getConfiscatedTotal());
        long surplus = state.getHeldBalance() - owed;
        return new SolvencyReport(
                state.getHeldBalance(),
                totalStaked,
                state.getConfiscatedTotal(),
                surplus,
                surplus >= 0,
                clock.instant()
        );
    }

    @Scheduled(fixedDelayString = "${ledger.reconciliation.interval-seconds:300}000")
    public void reconcile() {
        if (!ledgerProperties.getReconciliation().isEnabled() || !ledgerStateService.isInitialized()) {
            return;
        }
        SolvencyReport report = checkSolvency();
        if (report.solvent() && report.balanced()) {
            log.debug("Solvency check passed heldBalance={} totalStaked={} confiscatedTotal={}",
                    report.heldBalance(), report.totalStaked(), report.confiscatedTotal());
            return;
        }
        log.error("Solvency mismatch heldBalance={} totalStaked={} confiscatedTotal={} surplus={}",
                report.heldBalance(), report.totalStaked(), report.confiscatedTotal(), report.surplus());
        metricsService.recordSolvencyMismatch();
        auditEventService.recordEvent("SOLVENCY_MISMATCH", null, report.surplus(),
                report.solvent() ? "Unaccounted surplus in custody" : "Custody below obligations",
                Map.of(
                        "heldBalance", report.heldBalance(),
                        "totalStaked", report.totalStaked(),
                        "confiscatedTotal", report.confiscatedTotal()
                ));
    }
}
