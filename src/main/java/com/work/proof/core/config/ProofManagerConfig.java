package com.work.proof.core.config;

import java.math.BigInteger;
import java.time.Duration;

import static com.work.proof.core.support.ValidationUtils.requireAddress;
import static com.work.proof.core.support.ValidationUtils.requireNonNull;
import static com.work.proof.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class ProofManagerConfig {

    private final Duration ackTimeout;
    private final Duration maxTimeoutAfter;
    private final BigInteger maxRewardPerProof;
    private final int purgeLimit;
    private final String escrowAddress;

    public ProofManagerConfig(Duration ackTimeout,
                              Duration maxTimeoutAfter,
                              BigInteger maxRewardPerProof,
                              int purgeLimit,
                              String escrowAddress) {
        this.ackTimeout = requirePositive(ackTimeout, "ackTimeout");
        this.maxTimeoutAfter = requirePositive(maxTimeoutAfter, "maxTimeoutAfter");
        if (maxTimeoutAfter.compareTo(ackTimeout) <= 0) {
            throw new IllegalArgumentException("maxTimeoutAfter 必须大于 ackTimeout");
        }
        this.maxRewardPerProof = requireNonNull(maxRewardPerProof, "maxRewardPerProof");
        if (maxRewardPerProof.signum() <= 0) {
            throw new IllegalArgumentException("maxRewardPerProof 必须大于0");
        }
        if (purgeLimit <= 0) {
            throw new IllegalArgumentException("purgeLimit 必须大于0");
        }
        this.purgeLimit = purgeLimit;
        this.escrowAddress = requireAddress(escrowAddress, "escrowAddress");
    }

    /**
     * 默认值：确认窗口 2 分钟，最长证明超时 2 天，单个证明奖励上限 25 USDC（6 位小数）。
     */
    public static ProofManagerConfig defaultConfig(String escrowAddress) {
        return new ProofManagerConfig(Duration.ofMinutes(2), Duration.ofDays(2),
                BigInteger.valueOf(25_000_000L), 10, escrowAddress);
    }

    public Duration getAckTimeout() {
        return ackTimeout;
    }

    public long getAckTimeoutSeconds() {
        return ackTimeout.getSeconds();
    }

    public Duration getMaxTimeoutAfter() {
        return maxTimeoutAfter;
    }

    public long getMaxTimeoutAfterSeconds() {
        return maxTimeoutAfter.getSeconds();
    }

    public BigInteger getMaxRewardPerProof() {
        return maxRewardPerProof;
    }

    public int getPurgeLimit() {
        return purgeLimit;
    }

    public String getEscrowAddress() {
        return escrowAddress;
    }
}
