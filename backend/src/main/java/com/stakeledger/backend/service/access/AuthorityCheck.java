package com.stakeledger.backend.service.access;

/**
 * Answers whether an identity holds the single administrative capability.
 */
public interface AuthorityCheck {

    boolean hasAdminCapability(String identity);
}
