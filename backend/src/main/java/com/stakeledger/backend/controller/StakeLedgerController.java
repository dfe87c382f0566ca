package com.stakeledger.backend.controller;

import com.stakeledger.backend.config.RequestCorrelationFilter;
import com.stakeledger.backend.dto.AmountRequest;
import com.stakeledger.backend.dto.AuditEventResponse;
import com.stakeledger.backend.dto.ConfigurationResponse;
import com.stakeledger.backend.dto.LedgerSummaryResponse;
import com.stakeledger.backend.dto.ParticipantResponse;
import com.stakeledger.backend.dto.UnregisterResponse;
import com.stakeledger.backend.service.AuditEventService;
import com.stakeledger.backend.service.StakeLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Tag(name = "Stake ledger", description = "Participant registration, staking and withdrawal")
public class StakeLedgerController {

    private final StakeLedgerService stakeLedgerService;
    private final AuditEventService auditEventService;

    @PostMapping("/register")
    @Operation(summary = "Register the caller, keeping the whole deposit as stake")
    public ResponseEntity<ParticipantResponse> register(@RequestHeader(RequestCorrelationFilter.CALLER_HEADER) String caller,
                                                        @Valid @RequestBody AmountRequest request) {
        ParticipantResponse response = stakeLedgerService.register(caller, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/unregister")
    @Operation(summary = "Leave the ledger and receive the full stake once the cooldown has elapsed")
    public ResponseEntity<UnregisterResponse> unregister(@RequestHeader(RequestCorrelationFilter.CALLER_HEADER) String caller) {
        long released = stakeLedgerService.unregister(caller);
        return ResponseEntity.ok(new UnregisterResponse(caller.trim(), released));
    }

    @PostMapping("/stake")
    @Operation(summary = "Add stake to an existing registration")
    public ResponseEntity<ParticipantResponse> stake(@RequestHeader(RequestCorrelationFilter.CALLER_HEADER) String caller,
                                                     @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(stakeLedgerService.stake(caller, request.getAmount()));
    }

    @PostMapping("/unstake")
    @Operation(summary = "Withdraw part of the stake once the cooldown has elapsed")
    public ResponseEntity<ParticipantResponse> unstake(@RequestHeader(RequestCorrelationFilter.CALLER_HEADER) String caller,
                                                       @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(stakeLedgerService.unstake(caller, request.getAmount()));
    }

    @GetMapping("/participants/{identity}")
    public ResponseEntity<ParticipantResponse> getParticipant(@PathVariable String identity) {
        return ResponseEntity.ok(stakeLedgerService.getParticipant(identity));
    }

    @GetMapping("/configuration")
    public ResponseEntity<ConfigurationResponse> getConfiguration() {
        return ResponseEntity.ok(stakeLedgerService.getConfiguration());
    }

    @GetMapping("/summary")
    public ResponseEntity<LedgerSummaryResponse> getSummary() {
        return ResponseEntity.ok(stakeLedgerService.getSummary());
    }

    @GetMapping("/events")
    @Operation(summary = "Most recent ledger notifications, newest first")
    public ResponseEntity<List<AuditEventResponse>> getEvents(@RequestParam(value = "identity", required = false) String identity) {
        return ResponseEntity.ok(auditEventService.recentEvents(identity));
    }
}
