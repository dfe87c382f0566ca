package com.stakeledger.backend.event;

import java.time.Instant;

public record AdminCapabilityGrantedEvent(String identity, String grantedBy, Instant occurredAt) implements LedgerEvent {

    @Override
    public String type() {
        return "ADMIN_GRANTED";
    }

    @Override
    public String subject() {
        return identity;
    }

    @Override
    public Long valueMoved() {
        return null;
    }
}
