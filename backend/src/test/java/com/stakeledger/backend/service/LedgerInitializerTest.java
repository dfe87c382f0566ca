package com.stakeledger.backend.service;

import com.stakeledger.backend.config.LedgerProperties;
import com.stakeledger.backend.dto.ConfigurationResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerInitializerTest {

    @Mock
    private StakeLedgerService stakeLedgerService;

    private LedgerProperties properties;
    private LedgerInitializer initializer;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        initializer = new LedgerInitializer(stakeLedgerService, properties);
    }

    @Test
    void appliesBootstrapSettingsOnFirstStart() {
        properties.getBootstrap().setEnabled(true);
        properties.getBootstrap().setAdmin("root");
        properties.getBootstrap().setDepositFloor(100);
        properties.getBootstrap().setCooldownPeriod(Duration.ofDays(1));
        when(stakeLedgerService.isInitialized()).thenReturn(false);

        initializer.run();

        verify(stakeLedgerService).initialize("root", 100, Duration.ofDays(1));
    }

    @Test
    void persistedStateWinsOverBootstrap() {
        properties.getBootstrap().setEnabled(true);
        properties.getBootstrap().setAdmin("root");
        when(stakeLedgerService.isInitialized()).thenReturn(true);
        when(stakeLedgerService.getConfiguration()).thenReturn(new ConfigurationResponse(50, 60));

        initializer.run();

        verify(stakeLedgerService, never()).initialize(anyString(), anyLong(), any());
    }

    @Test
    void enabledBootstrapWithoutAdminFailsStartup() {
        properties.getBootstrap().setEnabled(true);
        when(stakeLedgerService.isInitialized()).thenReturn(false);

        assertThatThrownBy(() -> initializer.run())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ledger.bootstrap.admin");
    }
}
