package com.work.proof.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 证明网络登记表实体类
 */
@TableName("proving_network")
public class ProvingNetworkEntity {

    @TableId(type = IdType.INPUT)
    private String network;

    private String address;

    private String status;

    private BigInteger owedReward;

    /**
     * 待确认的领取转账，四列同时为空或同时非空
     */
    private String payoutReference;

    private String payoutRecipient;

    private BigInteger payoutAmount;

    private String payoutPayload;

    private Instant updatedAt;

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public BigInteger getOwedReward() {
        return owedReward;
    }

    public void setOwedReward(BigInteger owedReward) {
        this.owedReward = owedReward;
    }

    public String getPayoutReference() {
        return payoutReference;
    }

    public void setPayoutReference(String payoutReference) {
        this.payoutReference = payoutReference;
    }

    public String getPayoutRecipient() {
        return payoutRecipient;
    }

    public void setPayoutRecipient(String payoutRecipient) {
        this.payoutRecipient = payoutRecipient;
    }

    public BigInteger getPayoutAmount() {
        return payoutAmount;
    }

    public void setPayoutAmount(BigInteger payoutAmount) {
        this.payoutAmount = payoutAmount;
    }

    public String getPayoutPayload() {
        return payoutPayload;
    }

    public void setPayoutPayload(String payoutPayload) {
        this.payoutPayload = payoutPayload;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
