package com.stakeledger.backend.exception;

/**
 * Error kinds surfaced by the ledger. Automated clients use {@link #isRetryable()} to tell
 * "try again later" apart from requests that can never succeed as issued.
 */
public enum LedgerErrorCode {
    NOT_AUTHORIZED(Category.AUTHORIZATION, false),
    LAST_ADMIN(Category.AUTHORIZATION, false),
    ALREADY_REGISTERED(Category.PRECONDITION, false),
    NOT_REGISTERED(Category.PRECONDITION, false),
    INSUFFICIENT_DEPOSIT(Category.PRECONDITION, false),
    INSUFFICIENT_STAKE(Category.PRECONDITION, false),
    INSUFFICIENT_FUNDS(Category.PRECONDITION, false),
    ZERO_AMOUNT(Category.PRECONDITION, false),
    COOLDOWN_NOT_ELAPSED(Category.PRECONDITION, true),
    TRANSFER_FAILED(Category.EXTERNAL, true),
    REENTRANT_CALL(Category.PRECONDITION, true),
    ALREADY_INITIALIZED(Category.LIFECYCLE, false),
    NOT_INITIALIZED(Category.LIFECYCLE, true);

    public enum Category {
        AUTHORIZATION,
        PRECONDITION,
        EXTERNAL,
        LIFECYCLE
    }

    private final Category category;
    private final boolean retryable;

    LedgerErrorCode(Category category, boolean retryable) {
        this.category = category;
        this.retryable = retryable;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
