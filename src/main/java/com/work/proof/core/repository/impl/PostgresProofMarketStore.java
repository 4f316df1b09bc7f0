package com.work.proof.core.repository.impl;

import com.work.proof.core.escrow.PreparedTransfer;
import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.ProofManagerException;
import com.work.proof.core.model.MarketState;
import com.work.proof.core.model.ProofRequest;
import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProofRequestStatus;
import com.work.proof.core.model.ProtocolVersion;
import com.work.proof.core.model.ProvingNetwork;
import com.work.proof.core.model.ProvingNetworkInfo;
import com.work.proof.core.model.ProvingNetworkStatus;
import com.work.proof.core.repository.ProofMarketStore;
import com.work.proof.core.repository.entity.MarketStateEntity;
import com.work.proof.core.repository.entity.ProofRequestEntity;
import com.work.proof.core.repository.entity.ProvingNetworkEntity;
import com.work.proof.core.repository.mapper.MarketStateMapper;
import com.work.proof.core.repository.mapper.ProofRequestMapper;
import com.work.proof.core.repository.mapper.ProvingNetworkMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static com.work.proof.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 ProofMarketStore 实现。
 * <p>
 * 事务边界由 {@link #inTransaction(Supplier)} 统一管理：ProofManager 的每个写操作整体包在一个
 * READ_COMMITTED 事务里，任何异常都会回滚本次全部写入。
 */
public class PostgresProofMarketStore implements ProofMarketStore {

    private static final int TRANSACTION_TIMEOUT_SECONDS = 5;

    private final ProofRequestMapper requestMapper;
    private final ProvingNetworkMapper networkMapper;
    private final MarketStateMapper stateMapper;
    private final TransactionTemplate txTemplate;
    private final Clock clock;

    public PostgresProofMarketStore(ProofRequestMapper requestMapper,
                                    ProvingNetworkMapper networkMapper,
                                    MarketStateMapper stateMapper,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock) {
        this.requestMapper = requestMapper;
        this.networkMapper = networkMapper;
        this.stateMapper = stateMapper;
        this.clock = clock;
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout(TRANSACTION_TIMEOUT_SECONDS);
        this.txTemplate = template;
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return txTemplate.execute(status -> work.get());
    }

    @Override
    public Optional<ProofRequest> findRequest(ProofRequestId id) {
        requireNonNull(id, "id");
        ProofRequestEntity entity = requestMapper.findByChainAndBlock(id.getChainId(), id.getBlockNumber());
        return entity == null ? Optional.empty() : Optional.of(toRequest(entity));
    }

    @Override
    public boolean existsRequest(ProofRequestId id) {
        requireNonNull(id, "id");
        return requestMapper.countByChainAndBlock(id.getChainId(), id.getBlockNumber()) > 0;
    }

    @Override
    public void insertRequest(ProofRequest request) {
        requireNonNull(request, "request");
        requestMapper.insert(toEntity(request));
    }

    @Override
    public void updateRequest(ProofRequest request) {
        requireNonNull(request, "request");
        int updated = requestMapper.updateById(toEntity(request));
        if (updated == 0) {
            throw new ProofManagerException(ErrorCode.REQUEST_NOT_FOUND,
                    "更新证明请求失败，记录不存在: " + request.getId());
        }
    }

    @Override
    public List<ProofRequest> findExpirable() {
        return toRequests(requestMapper.listExpirable());
    }

    @Override
    public List<ProofRequest> findByAssigneeAndStatus(ProvingNetwork network, ProofRequestStatus status) {
        requireNonNull(network, "network");
        requireNonNull(status, "status");
        return toRequests(requestMapper.listByAssigneeAndStatus(network.name(), status.name()));
    }

    @Override
    public Optional<ProvingNetworkInfo> findNetwork(ProvingNetwork network) {
        requireNonNull(network, "network");
        ProvingNetworkEntity entity = networkMapper.selectById(network.name());
        if (entity == null) {
            return Optional.empty();
        }
        ProvingNetworkInfo info = new ProvingNetworkInfo(
                ProvingNetwork.valueOf(entity.getNetwork()),
                entity.getAddress(),
                ProvingNetworkStatus.valueOf(entity.getStatus()),
                zeroIfNull(entity.getOwedReward()));
        if (entity.getPayoutReference() != null) {
            info.setPendingPayout(new PreparedTransfer(entity.getPayoutReference(), entity.getPayoutRecipient(),
                    zeroIfNull(entity.getPayoutAmount()), entity.getPayoutPayload()));
        }
        return Optional.of(info);
    }

    @Override
    public void saveNetwork(ProvingNetworkInfo info) {
        requireNonNull(info, "info");
        PreparedTransfer payout = info.getPendingPayout();
        networkMapper.upsert(info.getNetwork().name(), info.getAddress(), info.getStatus().name(),
                info.getOwedReward(),
                payout == null ? null : payout.getReference(),
                payout == null ? null : payout.getTo(),
                payout == null ? null : payout.getAmount(),
                payout == null ? null : payout.getPayload(),
                clock.instant());
    }

    @Override
    public MarketState loadState() {
        MarketStateEntity entity = stateMapper.lockAndLoad();
        if (entity == null) {
            // 首次使用时补齐单行记录（并发初始化由 ON CONFLICT 兜住）
            stateMapper.insertIfNotExists(clock.instant());
            entity = stateMapper.lockAndLoad();
        }
        if (entity == null) {
            throw new ProofManagerException(ErrorCode.INVARIANT_VIOLATED, "market_state 初始化失败");
        }
        String preferred = entity.getPreferredNetwork();
        return new MarketState(
                entity.getRequestCounter() == null ? 0L : entity.getRequestCounter(),
                preferred == null ? ProvingNetwork.NONE : ProvingNetwork.valueOf(preferred),
                zeroIfNull(entity.getPotentialFutureReward()));
    }

    @Override
    public void saveState(MarketState state) {
        requireNonNull(state, "state");
        MarketStateEntity entity = new MarketStateEntity();
        entity.setId(MarketStateEntity.SINGLETON_ID);
        entity.setRequestCounter(state.getRequestCounter());
        entity.setPreferredNetwork(state.getPreferredNetwork().name());
        entity.setPotentialFutureReward(state.getPotentialFutureReward());
        entity.setUpdatedAt(clock.instant());
        if (stateMapper.updateById(entity) == 0) {
            stateMapper.insert(entity);
        }
    }

    private List<ProofRequest> toRequests(List<ProofRequestEntity> entities) {
        List<ProofRequest> out = new ArrayList<>(entities.size());
        for (ProofRequestEntity entity : entities) {
            out.add(toRequest(entity));
        }
        return out;
    }

    private ProofRequest toRequest(ProofRequestEntity entity) {
        ProofRequest request = new ProofRequest(
                ProofRequestId.of(entity.getChainId(), entity.getBlockNumber()),
                entity.getProofInputsUrl(),
                toVersion(entity),
                entity.getSubmittedAt(),
                entity.getTimeoutAfter(),
                zeroIfNull(entity.getMaxReward()),
                ProvingNetwork.valueOf(entity.getAssignedTo()),
                entity.getRequestId(),
                ProofRequestStatus.valueOf(entity.getStatus()),
                zeroIfNull(entity.getRequestedReward()),
                entity.getProof());
        request.setPayoutReference(entity.getPayoutReference());
        return request;
    }

    private ProofRequestEntity toEntity(ProofRequest request) {
        ProofRequestEntity entity = new ProofRequestEntity();
        entity.setRequestId(request.getRequestId());
        entity.setChainId(request.getId().getChainId());
        entity.setBlockNumber(request.getId().getBlockNumber());
        entity.setProofInputsUrl(request.getProofInputsUrl());
        ProtocolVersion version = request.getProtocolVersion();
        if (version != null) {
            entity.setProtocolMajor(version.getMajor());
            entity.setProtocolMinor(version.getMinor());
            entity.setProtocolPatch(version.getPatch());
        }
        entity.setSubmittedAt(request.getSubmittedAt());
        entity.setTimeoutAfter(request.getTimeoutAfter());
        entity.setMaxReward(request.getMaxReward());
        entity.setAssignedTo(request.getAssignedTo().name());
        entity.setStatus(request.getStatus().name());
        entity.setRequestedReward(request.getRequestedReward());
        entity.setProof(request.getProof());
        entity.setPayoutReference(request.getPayoutReference());
        entity.setUpdatedAt(clock.instant());
        return entity;
    }

    private static ProtocolVersion toVersion(ProofRequestEntity entity) {
        if (entity.getProtocolMajor() == null) {
            return null;
        }
        return new ProtocolVersion(entity.getProtocolMajor(), entity.getProtocolMinor(), entity.getProtocolPatch());
    }

    private static BigInteger zeroIfNull(BigInteger value) {
        return value == null ? BigInteger.ZERO : value;
    }
}
