package com.work.proof.core.admission;

import com.work.proof.core.config.ProofManagerConfig;
import com.work.proof.core.escrow.EscrowLedger;
import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.FundsUnavailableException;
import com.work.proof.core.exception.ProofManagerException;
import com.work.proof.core.model.MarketState;
import com.work.proof.core.model.ProofRequest;
import com.work.proof.core.model.ProofRequestStatus;
import com.work.proof.core.queue.ExpiryEntry;
import com.work.proof.core.queue.ExpiryQueue;
import com.work.proof.core.registry.ProvingNetworkRegistry;
import com.work.proof.core.repository.ProofMarketStore;
import com.work.proof.core.statemachine.ProofRequestTransitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 准入控制：提交前机会性清理过期请求，并确认托管余额足以覆盖所有可能的未来支付。
 *
 * 义务 = 两个网络的 owedReward + 已证明未验证的 potentialFutureReward；
 * 在途（未证明）请求按奖励上限保守计入，数量即 expiry queue 的大小。
 */
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final ProofManagerConfig config;
    private final ProofMarketStore store;
    private final EscrowLedger escrow;
    private final ProvingNetworkRegistry registry;
    private final ExpiryQueue expiryQueue;

    public AdmissionController(ProofManagerConfig config,
                               ProofMarketStore store,
                               EscrowLedger escrow,
                               ProvingNetworkRegistry registry,
                               ExpiryQueue expiryQueue) {
        this.config = config;
        this.store = store;
        this.escrow = escrow;
        this.registry = registry;
        this.expiryQueue = expiryQueue;
    }

    /**
     * 从 expiry queue 中取出最多 purgeLimit 个已到期（expiry <= now）的条目，
     * 返回已改为 UNACKNOWLEDGED / TIMED_OUT 的请求副本。
     * <p>
     * 这里只修改队列，不写存储：调用方在准入检查通过后再写回，失败时由队列重建恢复。
     */
    public List<ProofRequest> purgeExpired(long now) {
        List<ProofRequest> purged = new ArrayList<>();
        int limit = config.getPurgeLimit();
        while (purged.size() < limit && !expiryQueue.isEmpty() && expiryQueue.peekMin().getExpiry() <= now) {
            ExpiryEntry entry = expiryQueue.extractMin();
            Optional<ProofRequest> found = store.findRequest(entry.getId());
            if (!found.isPresent()) {
                throw new ProofManagerException(ErrorCode.INVARIANT_VIOLATED,
                        "expiry entry without request: " + entry.getId());
            }
            ProofRequest request = found.get();
            ProofRequestStatus target = timedOutStatusOf(request.getStatus());
            ProofRequestTransitions.requireAllowed(request.getStatus(), target);
            request.setStatus(target);
            purged.add(request);
            log.debug("purged expired request id={} status={} expiry={} now={}", entry.getId(), target, entry.getExpiry(), now);
        }
        return purged;
    }

    private static ProofRequestStatus timedOutStatusOf(ProofRequestStatus persisted) {
        if (persisted == ProofRequestStatus.PENDING_ACKNOWLEDGEMENT) {
            return ProofRequestStatus.UNACKNOWLEDGED;
        }
        if (persisted == ProofRequestStatus.COMMITTED) {
            return ProofRequestStatus.TIMED_OUT;
        }
        throw new ProofManagerException(ErrorCode.INVARIANT_VIOLATED,
                "expiry entry for non-expirable status: " + persisted);
    }

    public EscrowObligations obligations() {
        BigInteger balance = escrow.balanceOf(config.getEscrowAddress());
        return new EscrowObligations(balance == null ? BigInteger.ZERO : balance,
                registry.totalOwedReward(),
                store.loadState().getPotentialFutureReward(),
                expiryQueue.size(),
                config.getMaxRewardPerProof());
    }

    public void requireCapacity() {
        EscrowObligations o = obligations();
        if (!o.canAcceptNewRequest()) {
            log.warn("admission rejected: {}", o);
            throw new FundsUnavailableException(ErrorCode.NO_FUNDS_AVAILABLE,
                    "escrow cannot cover another request: slots=" + o.getRequestSlots() + " inFlight=" + o.getInFlight());
        }
    }

    /**
     * 证明提交后计入潜在奖励（按协商后的 requestedReward）。
     */
    public static void accruePotentialReward(MarketState state, BigInteger amount) {
        state.setPotentialFutureReward(state.getPotentialFutureReward().add(amount));
    }

    /**
     * 验证结果到达后释放潜在奖励，不允许减为负数。
     */
    public static void releasePotentialReward(MarketState state, BigInteger amount) {
        BigInteger next = state.getPotentialFutureReward().subtract(amount);
        if (next.signum() < 0) {
            throw new ProofManagerException(ErrorCode.INVARIANT_VIOLATED,
                    "potential future reward underflow: current=" + state.getPotentialFutureReward() + " release=" + amount);
        }
        state.setPotentialFutureReward(next);
    }
}
