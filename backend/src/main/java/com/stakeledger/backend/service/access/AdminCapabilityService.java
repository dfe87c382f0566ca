package com.stakeledger.backend.service.access;

import com.stakeledger.backend.exception.LedgerErrorCode;
import com.stakeledger.backend.exception.NotAuthorizedException;
import com.stakeledger.backend.model.AdminCapability;
import com.stakeledger.backend.repository.AdminCapabilityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class AdminCapabilityService implements AuthorityCheck {

    private final AdminCapabilityRepository adminCapabilityRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public boolean hasAdminCapability(String identity) {
        if (identity == null || identity.isBlank()) {
            return false;
        }
        return adminCapabilityRepository.existsById(identity);
    }

    /**
     * @return {@code false} when the identity already held the capability
     */
    @Transactional
    public boolean grant(String identity, String grantedBy) {
        if (adminCapabilityRepository.existsById(identity)) {
            return false;
        }
        adminCapabilityRepository.save(AdminCapability.builder()
                .identity(identity)
                .grantedBy(grantedBy)
                .grantedAt(clock.instant())
                .build());
        log.info("Admin capability granted identity={} grantedBy={}", identity, grantedBy);
        return true;
    }

    /**
     * @return {@code false} when the identity did not hold the capability
     */
    @Transactional
    public boolean revoke(String identity) {
        if (!adminCapabilityRepository.existsById(identity)) {
            return false;
        }
        if (adminCapabilityRepository.count() <= 1) {
            throw new NotAuthorizedException(LedgerErrorCode.LAST_ADMIN,
                    "Cannot revoke the last remaining admin capability holder " + identity);
        }
        adminCapabilityRepository.deleteById(identity);
        log.info("Admin capability revoked identity={}", identity);
        return true;
    }

    @Transactional(readOnly = true)
    public List<String> listAdmins() {
        return adminCapabilityRepository.findAll().stream()
                .map(AdminCapability::getIdentity)
                .sorted()
                .toList();
    }
}
