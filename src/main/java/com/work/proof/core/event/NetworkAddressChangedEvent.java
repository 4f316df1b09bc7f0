package com.work.proof.core.event;

import com.work.proof.core.model.ProvingNetwork;

public class NetworkAddressChangedEvent extends ProofMarketEvent {

    private final String address;

    public NetworkAddressChangedEvent(long timestamp, ProvingNetwork network, String address) {
        super(timestamp, network);
        this.address = address;
    }

    @Override
    public String getType() {
        return "NetworkAddressChanged";
    }

    public String getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return "NetworkAddressChanged{network=" + getNetwork() + ", address=" + address + '}';
    }
}
