package com.stakeledger.backend.exception;

public class NotAuthorizedException extends LedgerException {
    public NotAuthorizedException(String message) {
        super(LedgerErrorCode.NOT_AUTHORIZED, message);
    }

    public NotAuthorizedException(LedgerErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
