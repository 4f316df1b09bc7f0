package com.work.proof.core.event;

import com.work.proof.core.model.ProvingNetwork;

import java.math.BigInteger;

public class RewardPaidEvent extends ProofMarketEvent {

    private final String address;
    private final BigInteger amount;

    public RewardPaidEvent(long timestamp, ProvingNetwork network, String address, BigInteger amount) {
        super(timestamp, network);
        this.address = address;
        this.amount = amount;
    }

    @Override
    public String getType() {
        return "RewardPaid";
    }

    public String getAddress() {
        return address;
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public String toString() {
        return "RewardPaid{network=" + getNetwork() + ", address=" + address + ", amount=" + amount + '}';
    }
}
