package com.work.proof.core.exception;

/**
 * 调用方不具备所需角色，或不是该请求的受派网络。
 */
public class UnauthorizedException extends ProofManagerException {

    public UnauthorizedException(ErrorCode code, String message) {
        super(code, message);
    }
}
