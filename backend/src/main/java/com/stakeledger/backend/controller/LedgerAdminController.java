package com.stakeledger.backend.controller;

import com.stakeledger.backend.config.RequestCorrelationFilter;
import com.stakeledger.backend.dto.AdminGrantRequest;
import com.stakeledger.backend.dto.AmountRequest;
import com.stakeledger.backend.dto.ConfigurationRequest;
import com.stakeledger.backend.dto.ConfigurationResponse;
import com.stakeledger.backend.dto.SlashRequest;
import com.stakeledger.backend.dto.SolvencyReport;
import com.stakeledger.backend.dto.SweepResponse;
import com.stakeledger.backend.dto.SlashResponse;
import com.stakeledger.backend.service.SolvencyService;
import com.stakeledger.backend.service.StakeLedgerService;
import com.stakeledger.backend.service.access.AdminCapabilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/ledger/admin")
@RequiredArgsConstructor
@Tag(name = "Stake ledger admin", description = "Configuration, slashing and sweeping of confiscated funds")
public class LedgerAdminController {

    private final StakeLedgerService stakeLedgerService;
    private final SolvencyService solvencyService;
    private final AdminCapabilityService adminCapabilityService;

    @PutMapping("/configuration")
    @Operation(summary = "Replace the deposit floor and cooldown period for future actions")
    public ResponseEntity<ConfigurationResponse> setConfiguration(@RequestHeader(RequestCorrelationFilter.CALLER_HEADER) String caller,
                                                                  @Valid @RequestBody ConfigurationRequest request) {
        return ResponseEntity.ok(stakeLedgerService.setConfiguration(caller, request.getDepositFloor(), request.getCooldownPeriodSeconds()));
    }

    @PostMapping("/slash")
    @Operation(summary = "Confiscate part of a participant's stake into the confiscated pool")
    public ResponseEntity<SlashResponse> slash(@RequestHeader(RequestCorrelationFilter.CALLER_HEADER) String caller,
                                               @Valid @RequestBody SlashRequest request) {
        return ResponseEntity.ok(stakeLedgerService.slash(caller, request.getTarget(), request.getAmount()));
    }

    @PostMapping("/sweep")
    @Operation(summary = "Withdraw confiscated funds to the calling admin")
    public ResponseEntity<SweepResponse> sweep(@RequestHeader(RequestCorrelationFilter.CALLER_HEADER) String caller,
                                               @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(stakeLedgerService.sweep(caller, request.getAmount()));
    }

    @GetMapping("/grants")
    public ResponseEntity<List<String>> listAdmins() {
        return ResponseEntity.ok(adminCapabilityService.listAdmins());
    }

    @PostMapping("/grants")
    public ResponseEntity<Map<String, Object>> grant(@RequestHeader(RequestCorrelationFilter.CALLER_HEADER) String caller,
                                                     @Valid @RequestBody AdminGrantRequest request) {
        boolean granted = stakeLedgerService.grantAdmin(caller, request.getIdentity());
        return ResponseEntity.ok(Map.of("identity", request.getIdentity(), "changed", granted));
    }

    @DeleteMapping("/grants/{identity}")
    public ResponseEntity<Map<String, Object>> revoke(@RequestHeader(RequestCorrelationFilter.CALLER_HEADER) String caller,
                                                      @PathVariable String identity) {
        boolean revoked = stakeLedgerService.revokeAdmin(caller, identity);
        return ResponseEntity.ok(Map.of("identity", identity, "changed", revoked));
    }

    @GetMapping("/solvency")
    public ResponseEntity<SolvencyReport> solvency() {
        return ResponseEntity.ok(solvencyService.checkSolvency());
    }
}
