package com.stakeledger.backend.event;

import java.time.Instant;

public record SlashedEvent(String identity, long amount, String slashedBy, Instant occurredAt) implements LedgerEvent {

    @Override
    public String type() {
        return "SLASHED";
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
