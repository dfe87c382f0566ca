package com.stakeledger.backend.dto;

import java.time.Instant;

/**
 * Custody reconciliation: the ledger must hold at least what it owes participants plus the
 * confiscated pool. Any surplus means value entered the ledger without being credited.
 */
public record SolvencyReport(
        long heldBalance,
        long totalStaked,
        long confiscatedTotal,
        long surplus,
        boolean solvent,
        Instant checkedAt
) {
    public boolean balanced() {
        return surplus == 0;
    }
}
