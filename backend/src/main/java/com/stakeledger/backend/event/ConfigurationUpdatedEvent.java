package com.stakeledger.backend.event;

import java.time.Instant;

public record ConfigurationUpdatedEvent(long depositFloor, long cooldownPeriodSeconds, String updatedBy, Instant occurredAt) implements LedgerEvent {

    @Override
    public String type() {
        return "CONFIGURATION_UPDATED";
    }

    @Override
    public String subject() {
        return null;
    }

    @Override
    public Long valueMoved() {
        return null;
    }
}
