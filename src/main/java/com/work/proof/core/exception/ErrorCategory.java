package com.work.proof.core.exception;

/**
 * 失败原因的大类，决定调用方应当“稍后重试”还是“调用本身有误”。
 */
public enum ErrorCategory {
    AUTHORIZATION,
    VALIDATION,
    NOT_FOUND,
    STATE_MACHINE,
    TEMPORAL,
    RESOURCE,
    DOWNSTREAM,
    INTERNAL
}
