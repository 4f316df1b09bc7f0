package com.work.proof.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 每个 (chainId, blockNumber) 的权威记录。
 *
 * 注意：
 * 1. id、参数字段、submittedAt、requestId 是不可变字段，创建后不能修改
 * 2. status、requestedReward、proof 是可变字段，只在状态迁移时更新
 * 3. 存储层返回的是副本，修改后必须显式写回
 * 4. payoutReference 记录 VALIDATED 请求被纳入的那笔领取转账，转账确认后该请求才变为 PAID
 */
public class ProofRequest {

    private final ProofRequestId id;
    private final String proofInputsUrl;
    private final ProtocolVersion protocolVersion;
    private final long submittedAt;
    private final long timeoutAfter;
    private final BigInteger maxReward;
    private final ProvingNetwork assignedTo;
    private final long requestId;

    private ProofRequestStatus status;
    private BigInteger requestedReward;
    private byte[] proof;
    private String payoutReference;

    public ProofRequest(ProofRequestId id,
                        String proofInputsUrl,
                        ProtocolVersion protocolVersion,
                        long submittedAt,
                        long timeoutAfter,
                        BigInteger maxReward,
                        ProvingNetwork assignedTo,
                        long requestId,
                        ProofRequestStatus status,
                        BigInteger requestedReward,
                        byte[] proof) {
        if (id == null) {
            throw new IllegalArgumentException("id 不能为null");
        }
        if (submittedAt <= 0) {
            throw new IllegalArgumentException("submittedAt 必须大于0");
        }
        if (status == null) {
            throw new IllegalArgumentException("status 不能为null");
        }
        if (assignedTo == null) {
            throw new IllegalArgumentException("assignedTo 不能为null");
        }
        this.id = id;
        this.proofInputsUrl = proofInputsUrl;
        this.protocolVersion = protocolVersion;
        this.submittedAt = submittedAt;
        this.timeoutAfter = timeoutAfter;
        this.maxReward = maxReward;
        this.assignedTo = assignedTo;
        this.requestId = requestId;
        this.status = status;
        this.requestedReward = requestedReward == null ? BigInteger.ZERO : requestedReward;
        this.proof = proof == null ? new byte[0] : proof.clone();
    }

    public static ProofRequest create(ProofRequestId id,
                                      ProofRequestParams params,
                                      long submittedAt,
                                      ProvingNetwork assignedTo,
                                      long requestId,
                                      ProofRequestStatus status) {
        return new ProofRequest(id, params.getProofInputsUrl(), params.getProtocolVersion(), submittedAt,
                params.getTimeoutAfter(), params.getMaxReward(), assignedTo, requestId, status, BigInteger.ZERO, null);
    }

    public ProofRequest copy() {
        ProofRequest copy = new ProofRequest(id, proofInputsUrl, protocolVersion, submittedAt, timeoutAfter, maxReward,
                assignedTo, requestId, status, requestedReward, proof);
        copy.setPayoutReference(payoutReference);
        return copy;
    }

    public long ackDeadline(long ackTimeout) {
        return submittedAt + ackTimeout;
    }

    public long provingDeadline() {
        return submittedAt + timeoutAfter;
    }

    /**
     * 读取视图：持久化为 PENDING_ACKNOWLEDGEMENT/COMMITTED 但已过期的请求，直接报告为超时状态。
     */
    public ProofRequestStatus effectiveStatus(long now, long ackTimeout) {
        if (status == ProofRequestStatus.PENDING_ACKNOWLEDGEMENT && now > ackDeadline(ackTimeout)) {
            return ProofRequestStatus.UNACKNOWLEDGED;
        }
        if (status == ProofRequestStatus.COMMITTED && now > provingDeadline()) {
            return ProofRequestStatus.TIMED_OUT;
        }
        return status;
    }

    public ProofRequestId getId() {
        return id;
    }

    public String getProofInputsUrl() {
        return proofInputsUrl;
    }

    public ProtocolVersion getProtocolVersion() {
        return protocolVersion;
    }

    public long getSubmittedAt() {
        return submittedAt;
    }

    public long getTimeoutAfter() {
        return timeoutAfter;
    }

    public BigInteger getMaxReward() {
        return maxReward;
    }

    public ProvingNetwork getAssignedTo() {
        return assignedTo;
    }

    public long getRequestId() {
        return requestId;
    }

    /**
     * 持久化状态（不做懒计算）。
     */
    public ProofRequestStatus getStatus() {
        return status;
    }

    public void setStatus(ProofRequestStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status 不能为null");
        }
        this.status = status;
    }

    public BigInteger getRequestedReward() {
        return requestedReward;
    }

    public void setRequestedReward(BigInteger requestedReward) {
        this.requestedReward = requestedReward == null ? BigInteger.ZERO : requestedReward;
    }

    public byte[] getProof() {
        return proof.clone();
    }

    public void setProof(byte[] proof) {
        this.proof = proof == null ? new byte[0] : proof.clone();
    }

    public String getPayoutReference() {
        return payoutReference;
    }

    public void setPayoutReference(String payoutReference) {
        this.payoutReference = payoutReference;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProofRequest that = (ProofRequest) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ProofRequest{" +
                "id=" + id +
                ", requestId=" + requestId +
                ", status=" + status +
                ", assignedTo=" + assignedTo +
                ", submittedAt=" + submittedAt +
                ", timeoutAfter=" + timeoutAfter +
                ", maxReward=" + maxReward +
                ", requestedReward=" + requestedReward +
                ", proofLength=" + proof.length +
                '}';
    }
}
