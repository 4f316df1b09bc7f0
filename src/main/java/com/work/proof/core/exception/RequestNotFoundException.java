package com.work.proof.core.exception;

import com.work.proof.core.model.ProofRequestId;

public class RequestNotFoundException extends ProofManagerException {

    public RequestNotFoundException(ProofRequestId id) {
        super(ErrorCode.REQUEST_NOT_FOUND, "proof request not found: " + id);
    }
}
