package com.stakeledger.backend.util;

import com.stakeledger.backend.repository.AdminCapabilityRepository;
import com.stakeledger.backend.repository.AuditEventRepository;
import com.stakeledger.backend.repository.LedgerStateRepository;
import com.stakeledger.backend.repository.ParticipantStakeRepository;
import com.stakeledger.backend.repository.ValuePayoutRepository;

/**
 * Wipes every ledger table between tests sharing the in-memory database.
 */
public class LedgerTestSupport {

    private final ParticipantStakeRepository participantStakeRepository;
    private final AdminCapabilityRepository adminCapabilityRepository;
    private final LedgerStateRepository ledgerStateRepository;
    private final ValuePayoutRepository valuePayoutRepository;
    private final AuditEventRepository auditEventRepository;

    public LedgerTestSupport(ParticipantStakeRepository participantStakeRepository,
                             AdminCapabilityRepository adminCapabilityRepository,
                             LedgerStateRepository ledgerStateRepository,
                             ValuePayoutRepository valuePayoutRepository,
                             AuditEventRepository auditEventRepository) {
        this.participantStakeRepository = participantStakeRepository;
        this.adminCapabilityRepository = adminCapabilityRepository;
        this.ledgerStateRepository = ledgerStateRepository;
        this.valuePayoutRepository = valuePayoutRepository;
        this.auditEventRepository = auditEventRepository;
    }

    public void reset() {
        participantStakeRepository.deleteAll();
        adminCapabilityRepository.deleteAll();
        ledgerStateRepository.deleteAll();
        valuePayoutRepository.deleteAll();
        auditEventRepository.deleteAll();
    }
}
