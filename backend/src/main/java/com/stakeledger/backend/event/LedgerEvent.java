package com.stakeledger.backend.event;

import java.time.Instant;

/**
 * Notification published once per successful ledger operation.
 */
public interface LedgerEvent {

    String type();

    /**
     * Identity the event is about, or {@code null} for ledger-wide events.
     */
    String subject();

    /**
     * Value moved by the operation, or {@code null} when none moved.
     */
    Long valueMoved();

    Instant occurredAt();
}
