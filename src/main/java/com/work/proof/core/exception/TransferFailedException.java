package com.work.proof.core.exception;

/**
 * 下游 token 转账未成功，资金未移动，状态也未改变。调用方可稍后重试。
 */
public class TransferFailedException extends ProofManagerException {

    public TransferFailedException(String message) {
        super(ErrorCode.TRANSFER_FAILED, message);
    }

    public TransferFailedException(String message, Throwable cause) {
        super(ErrorCode.TRANSFER_FAILED, message, cause);
    }
}
