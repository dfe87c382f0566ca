package com.stakeledger.backend.service;

import com.stakeledger.backend.config.LedgerProperties;
import com.stakeledger.backend.dto.ConfigurationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Service;

/**
 * Applies the one-time ledger setup from configuration on first start. Persisted state always
 * wins over configuration afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerInitializer implements CommandLineRunner {

    private final StakeLedgerService stakeLedgerService;
    private final LedgerProperties ledgerProperties;

    @Override
    public void run(String... args) {
        if (stakeLedgerService.isInitialized()) {
            ConfigurationResponse configuration = stakeLedgerService.getConfiguration();
            log.info("Ledger already initialized depositFloor={} cooldownPeriodSeconds={}; bootstrap settings ignored",
                    configuration.depositFloor(), configuration.cooldownPeriodSeconds());
            return;
        }
        LedgerProperties.Bootstrap bootstrap = ledgerProperties.getBootstrap();
        if (!bootstrap.isEnabled()) {
            log.info("Ledger bootstrap disabled; waiting for explicit initialization");
            return;
        }
        if (bootstrap.getAdmin() == null || bootstrap.getAdmin().isBlank()) {
            throw new IllegalStateException("ledger.bootstrap.admin must be set when ledger.bootstrap.enabled=true");
        }
        stakeLedgerService.initialize(bootstrap.getAdmin(), bootstrap.getDepositFloor(), bootstrap.getCooldownPeriod());
    }
}
