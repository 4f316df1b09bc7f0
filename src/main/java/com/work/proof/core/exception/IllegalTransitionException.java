package com.work.proof.core.exception;

import com.work.proof.core.model.ProofRequestStatus;

/**
 * 当前状态不允许目标迁移。携带 from/to 便于排查。
 */
public class IllegalTransitionException extends ProofManagerException {

    private final ProofRequestStatus from;
    private final ProofRequestStatus to;

    public IllegalTransitionException(ProofRequestStatus from, ProofRequestStatus to) {
        super(ErrorCode.INVALID_TRANSITION, "transition not allowed: " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public ProofRequestStatus getFrom() {
        return from;
    }

    public ProofRequestStatus getTo() {
        return to;
    }
}
