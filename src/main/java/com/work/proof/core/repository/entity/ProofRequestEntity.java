package com.work.proof.core.repository.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 证明请求表实体类。request_id 即请求序号，(chain_id, block_number) 上有唯一约束。
 */
@TableName("proof_request")
public class ProofRequestEntity {

    @TableId(type = IdType.INPUT)
    private Long requestId;

    private Long chainId;

    private Long blockNumber;

    private String proofInputsUrl;

    private Integer protocolMajor;

    private Integer protocolMinor;

    private Integer protocolPatch;

    private Long submittedAt;

    private Long timeoutAfter;

    private BigInteger maxReward;

    private String assignedTo;

    private String status;

    private BigInteger requestedReward;

    private byte[] proof;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String payoutReference;

    private Instant updatedAt;

    public ProofRequestEntity() {
    }

    public Long getRequestId() {
        return requestId;
    }

    public void setRequestId(Long requestId) {
        this.requestId = requestId;
    }

    public Long getChainId() {
        return chainId;
    }

    public void setChainId(Long chainId) {
        this.chainId = chainId;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }

    public void setBlockNumber(Long blockNumber) {
        this.blockNumber = blockNumber;
    }

    public String getProofInputsUrl() {
        return proofInputsUrl;
    }

    public void setProofInputsUrl(String proofInputsUrl) {
        this.proofInputsUrl = proofInputsUrl;
    }

    public Integer getProtocolMajor() {
        return protocolMajor;
    }

    public void setProtocolMajor(Integer protocolMajor) {
        this.protocolMajor = protocolMajor;
    }

    public Integer getProtocolMinor() {
        return protocolMinor;
    }

    public void setProtocolMinor(Integer protocolMinor) {
        this.protocolMinor = protocolMinor;
    }

    public Integer getProtocolPatch() {
        return protocolPatch;
    }

    public void setProtocolPatch(Integer protocolPatch) {
        this.protocolPatch = protocolPatch;
    }

    public Long getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(Long submittedAt) {
        this.submittedAt = submittedAt;
    }

    public Long getTimeoutAfter() {
        return timeoutAfter;
    }

    public void setTimeoutAfter(Long timeoutAfter) {
        this.timeoutAfter = timeoutAfter;
    }

    public BigInteger getMaxReward() {
        return maxReward;
    }

    public void setMaxReward(BigInteger maxReward) {
        this.maxReward = maxReward;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public void setAssignedTo(String assignedTo) {
        this.assignedTo = assignedTo;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public BigInteger getRequestedReward() {
        return requestedReward;
    }

    public void setRequestedReward(BigInteger requestedReward) {
        this.requestedReward = requestedReward;
    }

    public byte[] getProof() {
        return proof;
    }

    public void setProof(byte[] proof) {
        this.proof = proof;
    }

    public String getPayoutReference() {
        return payoutReference;
    }

    public void setPayoutReference(String payoutReference) {
        this.payoutReference = payoutReference;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
