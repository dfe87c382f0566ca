package com.stakeledger.backend.config;

import com.stakeledger.backend.dto.LedgerSummaryResponse;
import com.stakeledger.backend.service.StakeLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StartupLifecycleListener implements ApplicationListener<ApplicationFailedEvent> {

    @Override
    public void onApplicationEvent(ApplicationFailedEvent event) {
        Throwable exception = event.getException();
        Throwable root = rootCause(exception);
        log.error("FATAL Startup failure. Root cause: {}", root.getMessage(), exception);
        for (Throwable suppressed : root.getSuppressed()) {
            log.error("FATAL Suppressed: {}", suppressed.getMessage(), suppressed);
        }
    }

    @Component
    @Slf4j
    @RequiredArgsConstructor
    public static class StartupReadyListener implements ApplicationListener<ApplicationReadyEvent> {

        private final StakeLedgerService stakeLedgerService;

        @Override
        public void onApplicationEvent(ApplicationReadyEvent event) {
            if (!stakeLedgerService.isInitialized()) {
                log.warn("Stake ledger ready but NOT initialized; all ledger operations will be rejected until setup");
                return;
            }
            LedgerSummaryResponse summary = stakeLedgerService.getSummary();
            log.info("Stake ledger ready: participants={} totalStaked={} confiscatedTotal={} heldBalance={} depositFloor={} cooldownPeriodSeconds={}",
                    summary.participantCount(), summary.totalStaked(), summary.confiscatedTotal(),
                    summary.heldBalance(), summary.depositFloor(), summary.cooldownPeriodSeconds());
        }
    }

    private Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
