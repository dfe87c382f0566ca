package com.stakeledger.backend.repository;

import com.stakeledger.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {
    List<AuditEvent> findTop100ByOrderByIdDesc();

    List<AuditEvent> findTop100BySubjectOrderByIdDesc(String subject);

    List<AuditEvent> findByEventTypeOrderByIdAsc(String eventType);
}
