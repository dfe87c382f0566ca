package com.stakeledger.backend.event;

import java.time.Instant;

public record LedgerInitializedEvent(String admin, long depositFloor, long cooldownPeriodSeconds, Instant occurredAt) implements LedgerEvent {

    @Override
    public String type() {
        return "LEDGER_INITIALIZED";
    }

    @Override
    public String subject() {
        return admin;
    }

    @Override
    public Long valueMoved() {
        return null;
    }
}
