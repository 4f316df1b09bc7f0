package com.work.proof.core.exception;

/**
 * 对外可区分的失败原因。每个 code 属于一个 {@link ErrorCategory}。
 */
public enum ErrorCode {

    UNAUTHORIZED(ErrorCategory.AUTHORIZATION, false),
    ONLY_ASSIGNEE(ErrorCategory.AUTHORIZATION, false),

    DUPLICATE_REQUEST(ErrorCategory.VALIDATION, false),
    INVALID_TIMEOUT(ErrorCategory.VALIDATION, false),
    REWARD_OUT_OF_BOUNDS(ErrorCategory.VALIDATION, false),
    EMPTY_PROOF(ErrorCategory.VALIDATION, false),
    INVALID_NETWORK(ErrorCategory.VALIDATION, false),
    INVALID_ADDRESS(ErrorCategory.VALIDATION, false),

    REQUEST_NOT_FOUND(ErrorCategory.NOT_FOUND, false),

    INVALID_TRANSITION(ErrorCategory.STATE_MACHINE, false),

    ACK_DEADLINE_PASSED(ErrorCategory.TEMPORAL, false),
    PROVING_DEADLINE_PASSED(ErrorCategory.TEMPORAL, false),

    NO_FUNDS_AVAILABLE(ErrorCategory.RESOURCE, true),
    NO_PAYMENT_DUE(ErrorCategory.RESOURCE, false),
    INSUFFICIENT_FUNDS(ErrorCategory.RESOURCE, true),
    PAYOUT_PENDING(ErrorCategory.RESOURCE, true),

    TRANSFER_FAILED(ErrorCategory.DOWNSTREAM, true),
    ESCROW_UNAVAILABLE(ErrorCategory.DOWNSTREAM, true),

    EMPTY_QUEUE(ErrorCategory.INTERNAL, false),
    KEY_NOT_FOUND(ErrorCategory.INTERNAL, false),
    INVARIANT_VIOLATED(ErrorCategory.INTERNAL, false);

    private final ErrorCategory category;
    private final boolean retryable;

    ErrorCode(ErrorCategory category, boolean retryable) {
        this.category = category;
        this.retryable = retryable;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
