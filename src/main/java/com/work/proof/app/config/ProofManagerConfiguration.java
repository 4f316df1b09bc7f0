package com.work.proof.app.config;

import com.work.proof.app.event.EventJournal;
import com.work.proof.app.event.SpringProofMarketEventPublisher;
import com.work.proof.core.ProofManager;
import com.work.proof.core.access.AccessControl;
import com.work.proof.core.access.StaticAccessControl;
import com.work.proof.core.config.ProofManagerConfig;
import com.work.proof.core.escrow.EscrowLedger;
import com.work.proof.core.escrow.InMemoryEscrowLedger;
import com.work.proof.core.event.ProofMarketEventPublisher;
import com.work.proof.core.repository.ProofMarketStore;
import com.work.proof.core.support.InMemoryProofMarketStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 将核心组件装配为 Spring Bean。
 * 默认使用内存存储与 mock 托管账本；postgres / web3j 实现分别由
 * {@link PostgresStoreConfiguration}、{@link Web3jConfiguration} 按配置提供。
 */
@Configuration
@EnableConfigurationProperties({ProofManagerProperties.class, EscrowProperties.class})
public class ProofManagerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProofManagerConfig proofManagerConfig(ProofManagerProperties properties) {
        return new ProofManagerConfig(
                properties.getAckTimeout(),
                properties.getMaxTimeoutAfter(),
                properties.getMaxRewardPerProof(),
                properties.getPurgeLimit(),
                properties.getEscrowAddress()
        );
    }

    @Bean
    public AccessControl accessControl(ProofManagerProperties properties) {
        return new StaticAccessControl(properties.getAdmins(), properties.getSubmitters());
    }

    @Bean
    @ConditionalOnProperty(prefix = "escrow", name = "mode", havingValue = "mock", matchIfMissing = true)
    public EscrowLedger inMemoryEscrowLedger(ProofManagerProperties properties, EscrowProperties escrow) {
        return new InMemoryEscrowLedger(properties.getEscrowAddress(), escrow.getInitialBalance());
    }

    @Bean
    @ConditionalOnProperty(prefix = "proof-manager", name = "store-mode", havingValue = "memory", matchIfMissing = true)
    public ProofMarketStore inMemoryProofMarketStore() {
        return new InMemoryProofMarketStore();
    }

    @Bean
    public EventJournal eventJournal(ProofManagerProperties properties) {
        return new EventJournal(properties.getEventJournalSize());
    }

    @Bean
    public ProofMarketEventPublisher proofMarketEventPublisher(EventJournal journal,
                                                               ApplicationEventPublisher applicationEventPublisher) {
        return new SpringProofMarketEventPublisher(journal, applicationEventPublisher);
    }

    @Bean
    public ProofManager proofManager(ProofManagerConfig config,
                                     ProofMarketStore store,
                                     EscrowLedger escrowLedger,
                                     AccessControl accessControl,
                                     Clock clock,
                                     ProofMarketEventPublisher publisher,
                                     ProofManagerProperties properties) {
        return new ProofManager(config, store, escrowLedger, accessControl, clock, publisher,
                properties.getFermahAddress(), properties.getLagrangeAddress());
    }
}
