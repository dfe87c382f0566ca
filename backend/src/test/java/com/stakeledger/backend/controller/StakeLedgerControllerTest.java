package com.stakeledger.backend.controller;

import com.stakeledger.backend.service.StakeLedgerService;
import com.stakeledger.backend.util.LedgerTestConfig;
import com.stakeledger.backend.util.LedgerTestSupport;
import com.stakeledger.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(LedgerTestConfig.class)
class StakeLedgerControllerTest {

    private static final String CALLER = "X-Caller-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StakeLedgerService stakeLedgerService;

    @Autowired
    private LedgerTestSupport ledgerTestSupport;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setup() {
        ledgerTestSupport.reset();
        clock.setInstant(LedgerTestConfig.START);
        stakeLedgerService.initialize("admin-1", 100, Duration.ofDays(1));
    }

    @Test
    void registerCreatesParticipant() throws Exception {
        mockMvc.perform(post("/api/ledger/register")
                        .header(CALLER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":150}"))
                .andExpect(status().isCreated())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(header().exists("X-Correlation-Id"))
                .andExpect(jsonPath("$.identity").value("alice"))
                .andExpect(jsonPath("$.stakedAmount").value(150))
                .andExpect(jsonPath("$.cooldownRemainingSeconds").value(86400));
    }

    @Test
    void missingCallerHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/ledger/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":150}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    void negativeAmountFailsValidation() throws Exception {
        mockMvc.perform(post("/api/ledger/stake")
                        .header(CALLER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":-5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("amount"));
    }

    @Test
    void depositBelowFloorIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/ledger/register")
                        .header(CALLER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":10}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_DEPOSIT"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void earlyUnregisterIsRetryableConflict() throws Exception {
        stakeLedgerService.register("alice", 100);

        mockMvc.perform(post("/api/ledger/unregister").header(CALLER, "alice"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("COOLDOWN_NOT_ELAPSED"))
                .andExpect(jsonPath("$.retryable").value(true));

        clock.advance(Duration.ofDays(1));

        mockMvc.perform(post("/api/ledger/unregister").header(CALLER, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.releasedAmount").value(100));
    }

    @Test
    void unknownParticipantReadsAsZeroed() throws Exception {
        mockMvc.perform(get("/api/ledger/participants/{identity}", "nobody"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.registered").value(false))
                .andExpect(jsonPath("$.registeredAt").value(0))
                .andExpect(jsonPath("$.stakedAmount").value(0));
    }

    @Test
    void eventsListsCommittedNotifications() throws Exception {
        stakeLedgerService.register("alice", 100);

        mockMvc.perform(get("/api/ledger/events").param("identity", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].eventType").value("REGISTERED"))
                .andExpect(jsonPath("$[0].amount").value(100));
    }

    @Test
    void overlongCallerIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/ledger/register")
                        .header(CALLER, "c".repeat(129))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":150}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
    }
}
