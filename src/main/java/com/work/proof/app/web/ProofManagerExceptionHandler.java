package com.work.proof.app.web;

import com.work.proof.app.web.dto.ErrorResponse;
import com.work.proof.core.exception.ErrorCategory;
import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.ProofManagerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 把 core 异常按类别映射为 HTTP 状态码，响应体携带 code 名称与消息。
 */
@RestControllerAdvice
public class ProofManagerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ProofManagerExceptionHandler.class);

    @ExceptionHandler(ProofManagerException.class)
    public ResponseEntity<ErrorResponse> handleProofManager(ProofManagerException e) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.warn("request failed code={} msg={}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(body(e.getCode().name(), e.getCategory().name(), e.getMessage(),
                e.isRetryable()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingCaller(MissingRequestHeaderException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body(ErrorCode.UNAUTHORIZED.name(),
                ErrorCategory.AUTHORIZATION.name(), e.getMessage(), false));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        FieldError first = e.getBindingResult().getFieldError();
        String msg = first == null ? "参数校验失败" : first.getField() + ": " + first.getDefaultMessage();
        return ResponseEntity.badRequest().body(body("INVALID_ARGUMENT", ErrorCategory.VALIDATION.name(), msg, false));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body("INVALID_ARGUMENT", ErrorCategory.VALIDATION.name(),
                e.getMessage(), false));
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code.getCategory()) {
            case AUTHORIZATION:
                return HttpStatus.FORBIDDEN;
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case STATE_MACHINE:
            case TEMPORAL:
                return HttpStatus.CONFLICT;
            case RESOURCE:
                return code.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.CONFLICT;
            case DOWNSTREAM:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ErrorResponse body(String code, String category, String message, boolean retryable) {
        ErrorResponse r = new ErrorResponse();
        r.setCode(code);
        r.setCategory(category);
        r.setMessage(message);
        r.setRetryable(retryable);
        return r;
    }
}
