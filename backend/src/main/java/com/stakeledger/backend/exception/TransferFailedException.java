package com.stakeledger.backend.exception;

public class TransferFailedException extends LedgerException {
    private final String recipient;
    private final long amount;

    public TransferFailedException(String recipient, long amount, String reason) {
        super(LedgerErrorCode.TRANSFER_FAILED, "Transfer of " + amount + " to " + recipient + " failed: " + reason);
        this.recipient = recipient;
        this.amount = amount;
    }

    public TransferFailedException(String recipient, long amount, Throwable cause) {
        super(LedgerErrorCode.TRANSFER_FAILED, "Transfer of " + amount + " to " + recipient + " failed: " + cause.getMessage(), cause);
        this.recipient = recipient;
        this.amount = amount;
    }

    public String getRecipient() {
        return recipient;
    }

    public long getAmount() {
        return amount;
    }
}
