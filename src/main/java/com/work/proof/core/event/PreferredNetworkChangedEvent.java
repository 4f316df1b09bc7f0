package com.work.proof.core.event;

import com.work.proof.core.model.ProvingNetwork;

/**
 * 偏好网络变更。getNetwork() 即新的偏好网络（可能为 NONE）。
 */
public class PreferredNetworkChangedEvent extends ProofMarketEvent {

    public PreferredNetworkChangedEvent(long timestamp, ProvingNetwork preferred) {
        super(timestamp, preferred);
    }

    @Override
    public String getType() {
        return "PreferredNetworkChanged";
    }

    @Override
    public String toString() {
        return "PreferredNetworkChanged{network=" + getNetwork() + '}';
    }
}
