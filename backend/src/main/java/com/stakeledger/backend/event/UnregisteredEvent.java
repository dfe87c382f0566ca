package com.stakeledger.backend.event;

import java.time.Instant;

public record UnregisteredEvent(String identity, long amount, Instant occurredAt) implements LedgerEvent {

    @Override
    public String type() {
        return "UNREGISTERED";
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
