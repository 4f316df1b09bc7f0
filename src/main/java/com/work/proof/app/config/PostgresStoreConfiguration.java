package com.work.proof.app.config;

import com.work.proof.core.repository.ProofMarketStore;
import com.work.proof.core.repository.impl.PostgresProofMarketStore;
import com.work.proof.core.repository.mapper.MarketStateMapper;
import com.work.proof.core.repository.mapper.ProofRequestMapper;
import com.work.proof.core.repository.mapper.ProvingNetworkMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * PostgreSQL + MyBatis-Plus 存储装配：proof-manager.store-mode=postgres 时启用。
 * 数据源配置见 application-postgres.yml。
 */
@Configuration
@ConditionalOnProperty(prefix = "proof-manager", name = "store-mode", havingValue = "postgres")
@MapperScan("com.work.proof.core.repository.mapper")
public class PostgresStoreConfiguration {

    @Bean
    public ProofMarketStore postgresProofMarketStore(ProofRequestMapper requestMapper,
                                                     ProvingNetworkMapper networkMapper,
                                                     MarketStateMapper stateMapper,
                                                     PlatformTransactionManager transactionManager,
                                                     Clock clock) {
        return new PostgresProofMarketStore(requestMapper, networkMapper, stateMapper, transactionManager, clock);
    }
}
