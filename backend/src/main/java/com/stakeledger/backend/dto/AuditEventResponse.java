package com.stakeledger.backend.dto;

import java.time.Instant;

public record AuditEventResponse(
        Long id,
        String eventType,
        String subject,
        Long amount,
        String description,
        String metadata,
        String correlationId,
        Instant createdAt
) {
}
