package com.stakeledger.backend.service.transfer;

public record TransferResult(boolean success, String reference, String failureReason) {

    public static TransferResult completed(String reference) {
        return new TransferResult(true, reference, null);
    }

    public static TransferResult failed(String reason) {
        return new TransferResult(false, null, reason);
    }
}
