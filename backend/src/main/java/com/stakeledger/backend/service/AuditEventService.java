package com.stakeledger.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stakeledger.backend.dto.AuditEventResponse;
import com.stakeledger.backend.model.AuditEvent;
import com.stakeledger.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    private final AuditEventRepository auditEventRepository;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    /**
     * Written in its own transaction so it can run after the ledger transaction has committed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordEvent(String eventType, String subject, Long amount, String description, Object metadata) {
        try {
            String payload = metadata == null ? null : objectMapper.writeValueAsString(metadata);
            AuditEvent event = AuditEvent.builder()
                    .eventType(eventType)
                    .subject(subject)
                    .amount(amount)
                    .description(description)
                    .metadata(payload)
                    .correlationId(MDC.get("correlationId"))
                    .createdAt(clock.instant())
                    .build();
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.warn("Failed to record audit event {} for {} - {}", eventType, subject, e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<AuditEventResponse> recentEvents(String subject) {
        List<AuditEvent> events = (subject == null || subject.isBlank())
                ? auditEventRepository.findTop100ByOrderByIdDesc()
                : auditEventRepository.findTop100BySubjectOrderByIdDesc(subject.trim());
        return events.stream()
                .map(event -> new AuditEventResponse(
                        event.getId(),
                        event.getEventType(),
                        event.getSubject(),
                        event.getAmount(),
                        event.getDescription(),
                        event.getMetadata(),
                        event.getCorrelationId(),
                        event.getCreatedAt()))
                .toList();
    }
}
