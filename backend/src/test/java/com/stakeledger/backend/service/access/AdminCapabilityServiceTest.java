package com.stakeledger.backend.service.access;

import com.stakeledger.backend.exception.LedgerErrorCode;
import com.stakeledger.backend.exception.NotAuthorizedException;
import com.stakeledger.backend.model.AdminCapability;
import com.stakeledger.backend.repository.AdminCapabilityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdminCapabilityServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private AdminCapabilityRepository adminCapabilityRepository;

    private AdminCapabilityService adminCapabilityService;

    @BeforeEach
    void setUp() {
        adminCapabilityService = new AdminCapabilityService(adminCapabilityRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void grantStoresNewHolder() {
        when(adminCapabilityRepository.existsById("ops")).thenReturn(false);

        assertThat(adminCapabilityService.grant("ops", "root")).isTrue();

        ArgumentCaptor<AdminCapability> captor = ArgumentCaptor.forClass(AdminCapability.class);
        verify(adminCapabilityRepository).save(captor.capture());
        assertThat(captor.getValue().getGrantedBy()).isEqualTo("root");
        assertThat(captor.getValue().getGrantedAt()).isEqualTo(NOW);
    }

    @Test
    void grantIsNoOpForExistingHolder() {
        when(adminCapabilityRepository.existsById("ops")).thenReturn(true);

        assertThat(adminCapabilityService.grant("ops", "root")).isFalse();
        verify(adminCapabilityRepository, never()).save(any());
    }

    @Test
    void lastHolderCannotBeRevoked() {
        when(adminCapabilityRepository.existsById("root")).thenReturn(true);
        when(adminCapabilityRepository.count()).thenReturn(1L);

        assertThatThrownBy(() -> adminCapabilityService.revoke("root"))
                .isInstanceOf(NotAuthorizedException.class)
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.LAST_ADMIN);
        verify(adminCapabilityRepository, never()).deleteById(anyString());
    }

    @Test
    void revokeRemovesHolderWhenOthersRemain() {
        when(adminCapabilityRepository.existsById("ops")).thenReturn(true);
        when(adminCapabilityRepository.count()).thenReturn(2L);

        assertThat(adminCapabilityService.revoke("ops")).isTrue();
        verify(adminCapabilityRepository).deleteById("ops");
    }

    @Test
    void blankIdentityNeverHoldsCapability() {
        assertThat(adminCapabilityService.hasAdminCapability(" ")).isFalse();
        assertThat(adminCapabilityService.hasAdminCapability(null)).isFalse();
        verify(adminCapabilityRepository, never()).existsById(anyString());
    }

    @Test
    void listAdminsIsSorted() {
        when(adminCapabilityRepository.findAll()).thenReturn(List.of(
                AdminCapability.builder().identity("zed").build(),
                AdminCapability.builder().identity("amy").build()));

        assertThat(adminCapabilityService.listAdmins()).containsExactly("amy", "zed");
    }
}
