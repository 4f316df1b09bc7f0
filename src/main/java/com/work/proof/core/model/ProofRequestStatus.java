package com.work.proof.core.model;

/**
 * 证明请求生命周期状态。合法迁移见 {@link com.work.proof.core.statemachine.ProofRequestTransitions}。
 * <p>
 * UNACKNOWLEDGED / TIMED_OUT 在读取时可能是“懒计算”的视图值，持久化值只在 purge 处理该条目时才写入。
 */
public enum ProofRequestStatus {
    PENDING_ACKNOWLEDGEMENT,
    COMMITTED,
    REFUSED,
    UNACKNOWLEDGED,
    PROVEN,
    VALIDATED,
    VALIDATION_FAILED,
    PAID,
    TIMED_OUT;

    /**
     * 仍可能过期、因此必须在 expiry queue 中有条目的状态。
     */
    public boolean isExpirable() {
        return this == PENDING_ACKNOWLEDGEMENT || this == COMMITTED;
    }
}
