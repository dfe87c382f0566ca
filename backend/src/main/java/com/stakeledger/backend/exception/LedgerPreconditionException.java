package com.stakeledger.backend.exception;

public class LedgerPreconditionException extends LedgerException {
    public LedgerPreconditionException(LedgerErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
