package com.stakeledger.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ledger-wide state kept in a single row: configuration, the confiscated pool and the
 * total value the ledger holds in custody.
 */
@Entity
@Table(name = "ledger_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerState {

    @Id
    private Long id;

    @Column(nullable = false)
    private boolean initialized;

    @Column(name = "deposit_floor", nullable = false)
    private long depositFloor;

    @Column(name = "cooldown_period_seconds", nullable = false)
    private long cooldownPeriodSeconds;

    @Column(name = "confiscated_total", nullable = false)
    private long confiscatedTotal;

    @Column(name = "held_balance", nullable = false)
    private long heldBalance;

    @Version
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
