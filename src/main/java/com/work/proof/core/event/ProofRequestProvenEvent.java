package com.work.proof.core.event;

import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProvingNetwork;

import java.math.BigInteger;

public class ProofRequestProvenEvent extends ProofMarketEvent {

    private final ProofRequestId id;
    private final byte[] proof;
    private final BigInteger requestedReward;

    public ProofRequestProvenEvent(long timestamp, ProvingNetwork network, ProofRequestId id,
                                   byte[] proof, BigInteger requestedReward) {
        super(timestamp, network);
        this.id = id;
        this.proof = proof.clone();
        this.requestedReward = requestedReward;
    }

    @Override
    public String getType() {
        return "ProofRequestProven";
    }

    public ProofRequestId getId() {
        return id;
    }

    public byte[] getProof() {
        return proof.clone();
    }

    public BigInteger getRequestedReward() {
        return requestedReward;
    }

    @Override
    public String toString() {
        return "ProofRequestProven{id=" + id + ", network=" + getNetwork() + ", requestedReward=" + requestedReward
                + ", proofLength=" + proof.length + '}';
    }
}
