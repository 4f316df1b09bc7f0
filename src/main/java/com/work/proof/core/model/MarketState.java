package com.work.proof.core.model;

import java.math.BigInteger;

/**
 * 全局标量状态：请求计数器、偏好网络、已证明未验证的潜在奖励总额。
 */
public class MarketState {

    private long requestCounter;
    private ProvingNetwork preferredNetwork;
    private BigInteger potentialFutureReward;

    public MarketState(long requestCounter, ProvingNetwork preferredNetwork, BigInteger potentialFutureReward) {
        this.requestCounter = requestCounter;
        this.preferredNetwork = preferredNetwork == null ? ProvingNetwork.NONE : preferredNetwork;
        this.potentialFutureReward = potentialFutureReward == null ? BigInteger.ZERO : potentialFutureReward;
    }

    public static MarketState init() {
        return new MarketState(0L, ProvingNetwork.NONE, BigInteger.ZERO);
    }

    public MarketState copy() {
        return new MarketState(requestCounter, preferredNetwork, potentialFutureReward);
    }

    public long getRequestCounter() {
        return requestCounter;
    }

    public void setRequestCounter(long requestCounter) {
        this.requestCounter = requestCounter;
    }

    public ProvingNetwork getPreferredNetwork() {
        return preferredNetwork;
    }

    public void setPreferredNetwork(ProvingNetwork preferredNetwork) {
        this.preferredNetwork = preferredNetwork;
    }

    public BigInteger getPotentialFutureReward() {
        return potentialFutureReward;
    }

    public void setPotentialFutureReward(BigInteger potentialFutureReward) {
        this.potentialFutureReward = potentialFutureReward;
    }
}
