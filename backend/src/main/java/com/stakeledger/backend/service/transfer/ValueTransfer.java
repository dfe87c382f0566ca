package com.stakeledger.backend.service.transfer;

/**
 * Moves value out of the ledger to an external identity. Implementations report failure through
 * {@link TransferResult} and are not expected to undo anything themselves; the ledger reverses its
 * own bookkeeping when a transfer does not succeed.
 */
public interface ValueTransfer {

    TransferResult send(String recipient, long amount);
}
