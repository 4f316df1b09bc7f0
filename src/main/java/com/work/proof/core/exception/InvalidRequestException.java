package com.work.proof.core.exception;

/**
 * 参数不合法：超时越界、奖励越界、重复提交、空 proof 等。
 */
public class InvalidRequestException extends ProofManagerException {

    public InvalidRequestException(ErrorCode code, String message) {
        super(code, message);
    }
}
