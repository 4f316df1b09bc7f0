package com.work.proof.core.model;

import java.math.BigInteger;

import static com.work.proof.core.support.ValidationUtils.requireNonEmpty;
import static com.work.proof.core.support.ValidationUtils.requireNonNegative;
import static com.work.proof.core.support.ValidationUtils.requireNonNull;

/**
 * 提交请求时的载荷。这里只做形状校验，业务边界（超时区间、奖励上限）由 ProofManager 按配置校验。
 */
public final class ProofRequestParams {

    private final String proofInputsUrl;
    private final ProtocolVersion protocolVersion;
    /**
     * 相对 submittedAt 的证明超时，单位秒。
     */
    private final long timeoutAfter;
    private final BigInteger maxReward;

    public ProofRequestParams(String proofInputsUrl,
                              ProtocolVersion protocolVersion,
                              long timeoutAfter,
                              BigInteger maxReward) {
        this.proofInputsUrl = requireNonEmpty(proofInputsUrl, "proofInputsUrl");
        this.protocolVersion = requireNonNull(protocolVersion, "protocolVersion");
        this.timeoutAfter = requireNonNegative(timeoutAfter, "timeoutAfter");
        this.maxReward = requireNonNegative(maxReward, "maxReward");
    }

    public String getProofInputsUrl() {
        return proofInputsUrl;
    }

    public ProtocolVersion getProtocolVersion() {
        return protocolVersion;
    }

    public long getTimeoutAfter() {
        return timeoutAfter;
    }

    public BigInteger getMaxReward() {
        return maxReward;
    }
}
