package com.stakeledger.backend.service.transfer;

import com.stakeledger.backend.config.LedgerProperties;
import com.stakeledger.backend.model.ValuePayout;
import com.stakeledger.backend.repository.ValuePayoutRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Book-entry transfer that records each payout instead of moving real funds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaperValueTransfer implements ValueTransfer {

    private final ValuePayoutRepository valuePayoutRepository;
    private final LedgerProperties ledgerProperties;
    private final Clock clock;

    @Override
    public TransferResult send(String recipient, long amount) {
        if (recipient == null || recipient.isBlank()) {
            return TransferResult.failed("recipient missing");
        }
        if (amount <= 0) {
            return TransferResult.failed("amount must be positive");
        }
        if (ledgerProperties.getTransfer().getRefusedRecipients().contains(recipient)) {
            log.warn("Paper transfer refused recipient={} amount={}", recipient, amount);
            return TransferResult.failed("recipient refused payment");
        }
        String reference = UUID.randomUUID().toString();
        valuePayoutRepository.save(ValuePayout.builder()
                .reference(reference)
                .recipient(recipient)
                .amount(amount)
                .correlationId(MDC.get("correlationId"))
                .createdAt(clock.instant())
                .build());
        log.debug("Paper transfer recorded reference={} recipient={} amount={}", reference, recipient, amount);
        return TransferResult.completed(reference);
    }
}
