package com.work.proof.core.event;

import com.work.proof.core.model.ProofRequest;
import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProofRequestStatus;
import com.work.proof.core.model.ProtocolVersion;

import java.math.BigInteger;

public class ProofRequestSubmittedEvent extends ProofMarketEvent {

    private final ProofRequestId id;
    private final long requestId;
    private final String proofInputsUrl;
    private final ProtocolVersion protocolVersion;
    private final long timeoutAfter;
    private final BigInteger maxReward;
    private final ProofRequestStatus status;

    public ProofRequestSubmittedEvent(ProofRequest request) {
        super(request.getSubmittedAt(), request.getAssignedTo());
        this.id = request.getId();
        this.requestId = request.getRequestId();
        this.proofInputsUrl = request.getProofInputsUrl();
        this.protocolVersion = request.getProtocolVersion();
        this.timeoutAfter = request.getTimeoutAfter();
        this.maxReward = request.getMaxReward();
        this.status = request.getStatus();
    }

    @Override
    public String getType() {
        return "ProofRequestSubmitted";
    }

    public ProofRequestId getId() {
        return id;
    }

    public long getRequestId() {
        return requestId;
    }

    public String getProofInputsUrl() {
        return proofInputsUrl;
    }

    public ProtocolVersion getProtocolVersion() {
        return protocolVersion;
    }

    public long getTimeoutAfter() {
        return timeoutAfter;
    }

    public BigInteger getMaxReward() {
        return maxReward;
    }

    public ProofRequestStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "ProofRequestSubmitted{id=" + id + ", requestId=" + requestId + ", assignedTo=" + getNetwork()
                + ", status=" + status + ", maxReward=" + maxReward + ", timeoutAfter=" + timeoutAfter + '}';
    }
}
