package com.stakeledger.backend.event;

import java.time.Instant;

public record WithdrawnEvent(String identity, long amount, Instant occurredAt) implements LedgerEvent {

    @Override
    public String type() {
        return "WITHDRAWN";
    }

    @Override
    public String subject() {
        return identity;
    }

    @Override
    public Long valueMoved() {
        return amount;
    }
}
