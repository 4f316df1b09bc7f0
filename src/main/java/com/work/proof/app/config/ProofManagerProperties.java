package com.work.proof.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 仅存在于宿主应用，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.proof.core.config.ProofManagerConfig}。
 */
@ConfigurationProperties(prefix = "proof-manager")
public class ProofManagerProperties {

    /**
     * 受派网络确认窗口
     */
    private Duration ackTimeout = Duration.ofMinutes(2);

    /**
     * timeoutAfter 的上限
     */
    private Duration maxTimeoutAfter = Duration.ofDays(2);

    /**
     * 单个证明的奖励上限（USDC 最小单位，6 位小数）
     */
    private BigInteger maxRewardPerProof = BigInteger.valueOf(25_000_000L);

    /**
     * 每次 submit 最多 purge 的过期请求数
     */
    private int purgeLimit = 10;

    /**
     * 持有奖励资金的托管地址（web3j 模式下必须与签名私钥对应的地址一致）
     */
    private String escrowAddress;

    private String fermahAddress;

    private String lagrangeAddress;

    private List<String> admins = new ArrayList<>();

    private List<String> submitters = new ArrayList<>();

    /**
     * memory 或 postgres
     */
    private String storeMode = "memory";

    /**
     * 事件日志保留的最大条数
     */
    private int eventJournalSize = 10_000;

    public Duration getAckTimeout() {
        return ackTimeout;
    }

    public void setAckTimeout(Duration ackTimeout) {
        this.ackTimeout = ackTimeout;
    }

    public Duration getMaxTimeoutAfter() {
        return maxTimeoutAfter;
    }

    public void setMaxTimeoutAfter(Duration maxTimeoutAfter) {
        this.maxTimeoutAfter = maxTimeoutAfter;
    }

    public BigInteger getMaxRewardPerProof() {
        return maxRewardPerProof;
    }

    public void setMaxRewardPerProof(BigInteger maxRewardPerProof) {
        this.maxRewardPerProof = maxRewardPerProof;
    }

    public int getPurgeLimit() {
        return purgeLimit;
    }

    public void setPurgeLimit(int purgeLimit) {
        this.purgeLimit = purgeLimit;
    }

    public String getEscrowAddress() {
        return escrowAddress;
    }

    public void setEscrowAddress(String escrowAddress) {
        this.escrowAddress = escrowAddress;
    }

    public String getFermahAddress() {
        return fermahAddress;
    }

    public void setFermahAddress(String fermahAddress) {
        this.fermahAddress = fermahAddress;
    }

    public String getLagrangeAddress() {
        return lagrangeAddress;
    }

    public void setLagrangeAddress(String lagrangeAddress) {
        this.lagrangeAddress = lagrangeAddress;
    }

    public List<String> getAdmins() {
        return admins;
    }

    public void setAdmins(List<String> admins) {
        this.admins = admins;
    }

    public List<String> getSubmitters() {
        return submitters;
    }

    public void setSubmitters(List<String> submitters) {
        this.submitters = submitters;
    }

    public String getStoreMode() {
        return storeMode;
    }

    public void setStoreMode(String storeMode) {
        this.storeMode = storeMode;
    }

    public int getEventJournalSize() {
        return eventJournalSize;
    }

    public void setEventJournalSize(int eventJournalSize) {
        this.eventJournalSize = eventJournalSize;
    }
}
