package com.work.proof.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 托管资金账本配置。
 *
 * mode=mock: 使用 InMemoryEscrowLedger
 * mode=web3j: 通过 JSON-RPC 访问链上 USDC 合约
 */
@ConfigurationProperties(prefix = "escrow")
public class EscrowProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * mock 模式下托管地址的初始余额（USDC 最小单位）
     */
    private BigInteger initialBalance = BigInteger.valueOf(1_000_000_000_000L);

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * ERC-20 代币合约地址
     */
    private String tokenAddress;

    /**
     * 托管地址的签名私钥（hex）。生产环境应通过环境变量或密钥服务注入。
     */
    private String privateKey;

    private long chainId = 1L;

    /**
     * 等待转账回执的轮询间隔与次数
     */
    private Duration receiptPollInterval = Duration.ofSeconds(1);

    private int receiptPollAttempts = 60;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public BigInteger getInitialBalance() {
        return initialBalance;
    }

    public void setInitialBalance(BigInteger initialBalance) {
        this.initialBalance = initialBalance;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getTokenAddress() {
        return tokenAddress;
    }

    public void setTokenAddress(String tokenAddress) {
        this.tokenAddress = tokenAddress;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public Duration getReceiptPollInterval() {
        return receiptPollInterval;
    }

    public void setReceiptPollInterval(Duration receiptPollInterval) {
        this.receiptPollInterval = receiptPollInterval;
    }

    public int getReceiptPollAttempts() {
        return receiptPollAttempts;
    }

    public void setReceiptPollAttempts(int receiptPollAttempts) {
        this.receiptPollAttempts = receiptPollAttempts;
    }
}
