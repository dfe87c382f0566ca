package com.stakeledger.backend.service;

import com.stakeledger.backend.event.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Fans committed ledger notifications out to the audit log, metrics and the application log.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LedgerEventListener {

    private final AuditEventService auditEventService;
    private final MetricsService metricsService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onLedgerEvent(LedgerEvent event) {
        log.info("Ledger event type={} subject={} amount={} occurredAt={}",
                event.type(), event.subject(), event.valueMoved(), event.occurredAt());
        metricsService.recordEvent(event.type());
        if (event.valueMoved() != null) {
            metricsService.recordValueMoved(event.type(), event.valueMoved());
        }
        auditEventService.recordEvent(event.type(), event.subject(), event.valueMoved(), describe(event), event);
    }

    private String describe(LedgerEvent event) {
        if (event.valueMoved() == null) {
            return event.type() + (event.subject() != null ? " " + event.subject() : "");
        }
        return event.type() + " " + event.subject() + " " + event.valueMoved();
    }
}
