package com.work.proof.core.repository;

import com.work.proof.core.model.MarketState;
import com.work.proof.core.model.ProofRequest;
import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProofRequestStatus;
import com.work.proof.core.model.ProvingNetwork;
import com.work.proof.core.model.ProvingNetworkInfo;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 抽象出所有与存储交互的操作，可由内存或 PostgreSQL + MyBatis-Plus 实现。
 * <p>
 * 读取方法返回副本，调用方修改后必须显式写回。
 */
public interface ProofMarketStore {

    Optional<ProofRequest> findRequest(ProofRequestId id);

    boolean existsRequest(ProofRequestId id);

    void insertRequest(ProofRequest request);

    void updateRequest(ProofRequest request);

    /**
     * 持久化状态仍为 PENDING_ACKNOWLEDGEMENT / COMMITTED 的请求，用于重建 expiry queue。
     */
    List<ProofRequest> findExpirable();

    List<ProofRequest> findByAssigneeAndStatus(ProvingNetwork network, ProofRequestStatus status);

    Optional<ProvingNetworkInfo> findNetwork(ProvingNetwork network);

    /**
     * 插入或更新。
     */
    void saveNetwork(ProvingNetworkInfo info);

    MarketState loadState();

    void saveState(MarketState state);

    /**
     * 在一个原子单元中执行 work：work 抛出异常时本次所有写入都不生效。
     */
    <T> T inTransaction(Supplier<T> work);
}
