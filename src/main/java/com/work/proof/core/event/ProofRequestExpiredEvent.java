package com.work.proof.core.event;

import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProofRequestStatus;
import com.work.proof.core.model.ProvingNetwork;

/**
 * purge 将请求持久化为 UNACKNOWLEDGED / TIMED_OUT 时发出。
 */
public class ProofRequestExpiredEvent extends ProofMarketEvent {

    private final ProofRequestId id;
    private final ProofRequestStatus status;

    public ProofRequestExpiredEvent(long timestamp, ProvingNetwork network, ProofRequestId id, ProofRequestStatus status) {
        super(timestamp, network);
        this.id = id;
        this.status = status;
    }

    @Override
    public String getType() {
        return "ProofRequestExpired";
    }

    public ProofRequestId getId() {
        return id;
    }

    public ProofRequestStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "ProofRequestExpired{id=" + id + ", network=" + getNetwork() + ", status=" + status + '}';
    }
}
