package com.work.proof.core.exception;

/**
 * 确认窗口或证明窗口已经关闭。
 */
public class DeadlinePassedException extends ProofManagerException {

    private final long deadline;
    private final long now;

    public DeadlinePassedException(ErrorCode code, long deadline, long now) {
        super(code, code.name().toLowerCase() + ": deadline=" + deadline + " now=" + now);
        this.deadline = deadline;
        this.now = now;
    }

    public long getDeadline() {
        return deadline;
    }

    public long getNow() {
        return now;
    }
}
