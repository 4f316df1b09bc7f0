package com.work.proof.core.model;

import com.work.proof.core.escrow.PreparedTransfer;

import java.math.BigInteger;

/**
 * 单个证明网络的登记信息：身份/收款地址、启用状态、已验证未领取的奖励。
 * <p>
 * pendingPayout 非空表示有一笔已签名的领取转账结果尚未确认，期间不允许再发起新的转账。
 */
public class ProvingNetworkInfo {

    private final ProvingNetwork network;
    private String address;
    private ProvingNetworkStatus status;
    private BigInteger owedReward;
    private PreparedTransfer pendingPayout;

    public ProvingNetworkInfo(ProvingNetwork network, String address, ProvingNetworkStatus status, BigInteger owedReward) {
        if (network == null || !network.isReal()) {
            throw new IllegalArgumentException("network 必须是真实网络");
        }
        this.network = network;
        this.address = address;
        this.status = status == null ? ProvingNetworkStatus.ACTIVE : status;
        this.owedReward = owedReward == null ? BigInteger.ZERO : owedReward;
    }

    public ProvingNetworkInfo copy() {
        ProvingNetworkInfo copy = new ProvingNetworkInfo(network, address, status, owedReward);
        copy.setPendingPayout(pendingPayout);
        return copy;
    }

    public ProvingNetwork getNetwork() {
        return network;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public ProvingNetworkStatus getStatus() {
        return status;
    }

    public void setStatus(ProvingNetworkStatus status) {
        this.status = status;
    }

    public boolean isActive() {
        return status == ProvingNetworkStatus.ACTIVE;
    }

    public BigInteger getOwedReward() {
        return owedReward;
    }

    public void setOwedReward(BigInteger owedReward) {
        this.owedReward = owedReward;
    }

    public PreparedTransfer getPendingPayout() {
        return pendingPayout;
    }

    public void setPendingPayout(PreparedTransfer pendingPayout) {
        this.pendingPayout = pendingPayout;
    }

    @Override
    public String toString() {
        return "ProvingNetworkInfo{" +
                "network=" + network +
                ", address='" + address + '\'' +
                ", status=" + status +
                ", owedReward=" + owedReward +
                ", pendingPayout=" + pendingPayout +
                '}';
    }
}
