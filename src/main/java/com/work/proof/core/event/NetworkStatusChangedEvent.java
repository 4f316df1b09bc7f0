package com.work.proof.core.event;

import com.work.proof.core.model.ProvingNetwork;
import com.work.proof.core.model.ProvingNetworkStatus;

public class NetworkStatusChangedEvent extends ProofMarketEvent {

    private final ProvingNetworkStatus status;

    public NetworkStatusChangedEvent(long timestamp, ProvingNetwork network, ProvingNetworkStatus status) {
        super(timestamp, network);
        this.status = status;
    }

    @Override
    public String getType() {
        return "NetworkStatusChanged";
    }

    public ProvingNetworkStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "NetworkStatusChanged{network=" + getNetwork() + ", status=" + status + '}';
    }
}
