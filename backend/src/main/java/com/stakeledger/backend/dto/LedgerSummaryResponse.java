package com.stakeledger.backend.dto;

public record LedgerSummaryResponse(
        long depositFloor,
        long cooldownPeriodSeconds,
        long confiscatedTotal,
        long heldBalance,
        long totalStaked,
        long participantCount
) {
}
