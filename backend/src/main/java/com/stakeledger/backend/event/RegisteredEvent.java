package com.stakeledger.backend.event;

import java.time.Instant;

public record RegisteredEvent(String identity, long amount, Instant occurredAt) implements LedgerEvent {

    @Override
    public String type() {
        return "REGISTERED";
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
