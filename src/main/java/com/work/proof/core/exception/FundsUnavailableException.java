package com.work.proof.core.exception;

/**
 * 资源类失败：托管余额不足以接纳新请求、无可领取奖励、余额不足以支付。
 */
public class FundsUnavailableException extends ProofManagerException {

    public FundsUnavailableException(ErrorCode code, String message) {
        super(code, message);
    }
}
