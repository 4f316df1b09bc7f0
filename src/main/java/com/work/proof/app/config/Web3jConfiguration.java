package com.work.proof.app.config;

import com.work.proof.app.chain.web3j.Web3jEscrowLedger;
import com.work.proof.core.escrow.EscrowLedger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.DefaultGasProvider;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;

/**
 * Web3j 装配：
 * 当 escrow.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "escrow", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean
    public Web3j web3j(EscrowProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public EscrowLedger web3jEscrowLedger(Web3j web3j,
                                          EscrowProperties escrow,
                                          ProofManagerProperties proofManager) {
        if (escrow.getPrivateKey() == null || escrow.getPrivateKey().trim().isEmpty()) {
            throw new IllegalStateException("escrow.private-key 未配置");
        }
        Credentials credentials = Credentials.create(escrow.getPrivateKey().trim());
        if (!credentials.getAddress().equalsIgnoreCase(proofManager.getEscrowAddress())) {
            throw new IllegalStateException("escrow.private-key 对应地址 " + credentials.getAddress()
                    + " 与 proof-manager.escrow-address 不一致");
        }
        PollingTransactionReceiptProcessor receiptProcessor = new PollingTransactionReceiptProcessor(
                web3j, escrow.getReceiptPollInterval().toMillis(), escrow.getReceiptPollAttempts());
        return new Web3jEscrowLedger(web3j, credentials, escrow.getChainId(), receiptProcessor,
                new DefaultGasProvider(), escrow.getTokenAddress());
    }
}
