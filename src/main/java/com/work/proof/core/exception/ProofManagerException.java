package com.work.proof.core.exception;

/**
 * 组件内部的统一异常类型，便于业务侧捕获或转换为 HTTP 错误码。
 * <p>
 * 抛出该异常的操作不会留下任何部分写入。
 */
public class ProofManagerException extends RuntimeException {

    private final ErrorCode code;

    public ProofManagerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ProofManagerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    /**
     * 标识该异常是否可通过稍后重试解决（资金不足、下游转账失败等）。
     */
    public boolean isRetryable() {
        return code.isRetryable();
    }
}
