package com.work.proof.core.event;

import com.work.proof.core.model.ProvingNetwork;

/**
 * 对外可观测的事件基类。证明网络通过关注本网络的事件得知新的指派、地址/状态变更与付款。
 */
public abstract class ProofMarketEvent {

    private final long timestamp;
    private final ProvingNetwork network;

    protected ProofMarketEvent(long timestamp, ProvingNetwork network) {
        this.timestamp = timestamp;
        this.network = network == null ? ProvingNetwork.NONE : network;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * 与该事件相关的网络；与具体网络无关时为 NONE。
     */
    public ProvingNetwork getNetwork() {
        return network;
    }

    public abstract String getType();
}
