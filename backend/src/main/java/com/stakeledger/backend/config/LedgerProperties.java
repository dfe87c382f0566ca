package com.stakeledger.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Data
@Validated
public class LedgerProperties {

    @Valid
    private Bootstrap bootstrap = new Bootstrap();
    private Transfer transfer = new Transfer();
    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    /**
     * One-time setup applied on first start, when no ledger state is persisted yet.
     */
    @Data
    public static class Bootstrap {
        private boolean enabled = false;

        private String admin;

        @PositiveOrZero
        private long depositFloor = 0;

        @NotNull
        private Duration cooldownPeriod = Duration.ZERO;
    }

    @Data
    public static class Transfer {
        /**
         * Recipients the paper transfer refuses to pay, used to exercise failure handling.
         */
        private List<String> refusedRecipients = new ArrayList<>();
    }

    @Data
    public static class Reconciliation {
        private boolean enabled = true;

        @Min(1)
        private long intervalSeconds = 300;
    }
}
