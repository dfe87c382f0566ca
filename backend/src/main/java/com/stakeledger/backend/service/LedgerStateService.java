package com.stakeledger.backend.service;

import com.stakeledger.backend.entity.LedgerState;
import com.stakeledger.backend.exception.LedgerErrorCode;
import com.stakeledger.backend.exception.LedgerPreconditionException;
import com.stakeledger.backend.repository.LedgerStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class LedgerStateService {

    static final long SINGLETON_ID = 1L;

    private final LedgerStateRepository ledgerStateRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<LedgerState> findState() {
        return ledgerStateRepository.findById(SINGLETON_ID).filter(LedgerState::isInitialized);
    }

    @Transactional(readOnly = true)
    public boolean isInitialized() {
        return findState().isPresent();
    }

    @Transactional(readOnly = true)
    public LedgerState requireInitialized() {
        return findState().orElseThrow(() -> new LedgerPreconditionException(
                LedgerErrorCode.NOT_INITIALIZED, "Ledger has not been initialized"));
    }

    @Transactional
    public LedgerState create(long depositFloor, long cooldownPeriodSeconds) {
        if (isInitialized()) {
            throw new LedgerPreconditionException(LedgerErrorCode.ALREADY_INITIALIZED, "Ledger is already initialized");
        }
        LedgerState state = ledgerStateRepository.findById(SINGLETON_ID)
                .orElseGet(() -> LedgerState.builder().id(SINGLETON_ID).build());
        state.setInitialized(true);
        state.setDepositFloor(depositFloor);
        state.setCooldownPeriodSeconds(cooldownPeriodSeconds);
        state.setConfiscatedTotal(0L);
        state.setHeldBalance(0L);
        return save(state);
    }

    @Transactional
    public LedgerState save(LedgerState state) {
        state.setUpdatedAt(clock.instant());
        return ledgerStateRepository.saveAndFlush(state);
    }
}
