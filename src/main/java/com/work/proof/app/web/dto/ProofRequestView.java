package com.work.proof.app.web.dto;

/**
 * 证明请求视图。status 为懒计算后的状态，金额为十进制字符串，proof 为 hex。
 */
public class ProofRequestView {

    private long chainId;
    private long blockNumber;
    private long requestId;
    private String proofInputsUrl;
    private String protocolVersion;
    private long submittedAt;
    private long timeoutAfter;
    private String maxReward;
    private String assignedTo;
    private String status;
    private String requestedReward;
    private String proof;

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public void setBlockNumber(long blockNumber) {
        this.blockNumber = blockNumber;
    }

    public long getRequestId() {
        return requestId;
    }

    public void setRequestId(long requestId) {
        this.requestId = requestId;
    }

    public String getProofInputsUrl() {
        return proofInputsUrl;
    }

    public void setProofInputsUrl(String proofInputsUrl) {
        this.proofInputsUrl = proofInputsUrl;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public void setProtocolVersion(String protocolVersion) {
        this.protocolVersion = protocolVersion;
    }

    public long getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(long submittedAt) {
        this.submittedAt = submittedAt;
    }

    public long getTimeoutAfter() {
        return timeoutAfter;
    }

    public void setTimeoutAfter(long timeoutAfter) {
        this.timeoutAfter = timeoutAfter;
    }

    public String getMaxReward() {
        return maxReward;
    }

    public void setMaxReward(String maxReward) {
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

    public String getRequestedReward() {
        return requestedReward;
    }

    public void setRequestedReward(String requestedReward) {
        this.requestedReward = requestedReward;
    }

    public String getProof() {
        return proof;
    }

    public void setProof(String proof) {
        this.proof = proof;
    }
}
