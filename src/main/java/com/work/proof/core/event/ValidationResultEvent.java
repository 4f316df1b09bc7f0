package com.work.proof.core.event;

import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProvingNetwork;

public class ValidationResultEvent extends ProofMarketEvent {

    private final ProofRequestId id;
    private final boolean valid;

    public ValidationResultEvent(long timestamp, ProvingNetwork network, ProofRequestId id, boolean valid) {
        super(timestamp, network);
        this.id = id;
        this.valid = valid;
    }

    @Override
    public String getType() {
        return "ValidationResult";
    }

    public ProofRequestId getId() {
        return id;
    }

    public boolean isValid() {
        return valid;
    }

    @Override
    public String toString() {
        return "ValidationResult{id=" + id + ", network=" + getNetwork() + ", valid=" + valid + '}';
    }
}
