package com.work.proof.core.event;

import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProvingNetwork;

public class ProofRequestAcknowledgedEvent extends ProofMarketEvent {

    private final ProofRequestId id;
    private final boolean accepted;

    public ProofRequestAcknowledgedEvent(long timestamp, ProvingNetwork network, ProofRequestId id, boolean accepted) {
        super(timestamp, network);
        this.id = id;
        this.accepted = accepted;
    }

    @Override
    public String getType() {
        return "ProofRequestAcknowledged";
    }

    public ProofRequestId getId() {
        return id;
    }

    public boolean isAccepted() {
        return accepted;
    }

    @Override
    public String toString() {
        return "ProofRequestAcknowledged{id=" + id + ", network=" + getNetwork() + ", accepted=" + accepted + '}';
    }
}
