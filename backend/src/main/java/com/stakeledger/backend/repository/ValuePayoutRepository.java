package com.stakeledger.backend.repository;

import com.stakeledger.backend.model.ValuePayout;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ValuePayoutRepository extends JpaRepository<ValuePayout, Long> {
    List<ValuePayout> findByRecipientOrderByIdAsc(String recipient);
}
