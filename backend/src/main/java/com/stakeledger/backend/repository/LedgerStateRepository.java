package com.stakeledger.backend.repository;

import com.stakeledger.backend.entity.LedgerState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LedgerStateRepository extends JpaRepository<LedgerState, Long> {
}
