package com.stakeledger.backend.exception;

public class ReentrantCallException extends LedgerException {
    public ReentrantCallException(String operation) {
        super(LedgerErrorCode.REENTRANT_CALL, "Reentrant call to " + operation + " rejected while another ledger operation is in flight");
    }
}
