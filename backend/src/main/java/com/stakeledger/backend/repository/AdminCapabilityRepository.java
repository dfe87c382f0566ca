package com.stakeledger.backend.repository;

import com.stakeledger.backend.model.AdminCapability;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AdminCapabilityRepository extends JpaRepository<AdminCapability, String> {
}
