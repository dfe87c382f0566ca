package com.stakeledger.backend.event;

import java.time.Instant;

public record AdminCapabilityRevokedEvent(String identity, String revokedBy, Instant occurredAt) implements LedgerEvent {

    @Override
    public String type() {
        return "ADMIN_REVOKED";
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
