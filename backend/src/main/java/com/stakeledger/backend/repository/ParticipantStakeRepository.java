package com.stakeledger.backend.repository;

import com.stakeledger.backend.model.ParticipantStake;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ParticipantStakeRepository extends JpaRepository<ParticipantStake, String> {

    @Query("select coalesce(sum(p.stakedAmount), 0L) from ParticipantStake p")
    long sumStakedAmount();
}
