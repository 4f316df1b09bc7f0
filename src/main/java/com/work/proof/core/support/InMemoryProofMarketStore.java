package com.work.proof.core.support;

import com.work.proof.core.model.MarketState;
import com.work.proof.core.model.ProofRequest;
import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProofRequestStatus;
import com.work.proof.core.model.ProvingNetwork;
import com.work.proof.core.model.ProvingNetworkInfo;
import com.work.proof.core.repository.ProofMarketStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static com.work.proof.core.support.ValidationUtils.requireNonNull;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下演示组件行为。
 * 事务以快照实现：work 抛出异常时整体恢复到进入事务前的内容，嵌套调用并入外层事务。
 * 存放的都是副本且只整体替换，快照只需浅拷贝各个 Map。
 * 注意：该实现仅用于 demo/测试，不具备持久性与跨进程一致性。
 */
public class InMemoryProofMarketStore implements ProofMarketStore {

    private final Map<ProofRequestId, ProofRequest> requests = new ConcurrentHashMap<>();
    private final Map<ProvingNetwork, ProvingNetworkInfo> networks = new EnumMap<>(ProvingNetwork.class);
    private MarketState state = MarketState.init();
    private boolean inTransaction;

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        if (inTransaction) {
            return work.get();
        }
        Map<ProofRequestId, ProofRequest> requestsBefore = new HashMap<>(requests);
        Map<ProvingNetwork, ProvingNetworkInfo> networksBefore = new EnumMap<>(networks);
        MarketState stateBefore = state;
        inTransaction = true;
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            requests.clear();
            requests.putAll(requestsBefore);
            networks.clear();
            networks.putAll(networksBefore);
            state = stateBefore;
            throw e;
        } finally {
            inTransaction = false;
        }
    }

    @Override
    public Optional<ProofRequest> findRequest(ProofRequestId id) {
        ProofRequest r = requests.get(id);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public boolean existsRequest(ProofRequestId id) {
        return requests.containsKey(id);
    }

    @Override
    public void insertRequest(ProofRequest request) {
        requireNonNull(request, "request");
        ProofRequest prev = requests.putIfAbsent(request.getId(), request.copy());
        if (prev != null) {
            throw new IllegalStateException("proof request 已存在: " + request.getId());
        }
    }

    @Override
    public void updateRequest(ProofRequest request) {
        requireNonNull(request, "request");
        if (requests.replace(request.getId(), request.copy()) == null) {
            throw new IllegalStateException("未找到 proof request: " + request.getId());
        }
    }

    @Override
    public List<ProofRequest> findExpirable() {
        List<ProofRequest> out = new ArrayList<>();
        for (ProofRequest r : requests.values()) {
            if (r.getStatus().isExpirable()) {
                out.add(r.copy());
            }
        }
        out.sort(Comparator.comparingLong(ProofRequest::getRequestId));
        return out;
    }

    @Override
    public List<ProofRequest> findByAssigneeAndStatus(ProvingNetwork network, ProofRequestStatus status) {
        List<ProofRequest> out = new ArrayList<>();
        for (ProofRequest r : requests.values()) {
            if (r.getAssignedTo() == network && r.getStatus() == status) {
                out.add(r.copy());
            }
        }
        out.sort(Comparator.comparingLong(ProofRequest::getRequestId));
        return out;
    }

    @Override
    public synchronized Optional<ProvingNetworkInfo> findNetwork(ProvingNetwork network) {
        ProvingNetworkInfo info = networks.get(network);
        return info == null ? Optional.empty() : Optional.of(info.copy());
    }

    @Override
    public synchronized void saveNetwork(ProvingNetworkInfo info) {
        requireNonNull(info, "info");
        networks.put(info.getNetwork(), info.copy());
    }

    @Override
    public synchronized MarketState loadState() {
        return state.copy();
    }

    @Override
    public synchronized void saveState(MarketState state) {
        this.state = requireNonNull(state, "state").copy();
    }
}
