package com.work.proof.core;

import com.work.proof.core.access.AccessControl;
import com.work.proof.core.access.Role;
import com.work.proof.core.admission.AdmissionController;
import com.work.proof.core.admission.EscrowObligations;
import com.work.proof.core.assignment.AssignmentPolicy;
import com.work.proof.core.config.ProofManagerConfig;
import com.work.proof.core.escrow.EscrowLedger;
import com.work.proof.core.escrow.PreparedTransfer;
import com.work.proof.core.escrow.TransferStatus;
import com.work.proof.core.event.NetworkAddressChangedEvent;
import com.work.proof.core.event.NetworkStatusChangedEvent;
import com.work.proof.core.event.PreferredNetworkChangedEvent;
import com.work.proof.core.event.ProofMarketEvent;
import com.work.proof.core.event.ProofMarketEventPublisher;
import com.work.proof.core.event.ProofRequestAcknowledgedEvent;
import com.work.proof.core.event.ProofRequestExpiredEvent;
import com.work.proof.core.event.ProofRequestProvenEvent;
import com.work.proof.core.event.ProofRequestSubmittedEvent;
import com.work.proof.core.event.RewardPaidEvent;
import com.work.proof.core.event.ValidationResultEvent;
import com.work.proof.core.exception.DeadlinePassedException;
import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.FundsUnavailableException;
import com.work.proof.core.exception.IllegalTransitionException;
import com.work.proof.core.exception.InvalidRequestException;
import com.work.proof.core.exception.ProofManagerException;
import com.work.proof.core.exception.RequestNotFoundException;
import com.work.proof.core.exception.TransferFailedException;
import com.work.proof.core.exception.UnauthorizedException;
import com.work.proof.core.model.MarketState;
import com.work.proof.core.model.ProofRequest;
import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProofRequestParams;
import com.work.proof.core.model.ProofRequestStatus;
import com.work.proof.core.model.ProvingNetwork;
import com.work.proof.core.model.ProvingNetworkInfo;
import com.work.proof.core.model.ProvingNetworkStatus;
import com.work.proof.core.queue.ExpiryQueue;
import com.work.proof.core.registry.ProvingNetworkRegistry;
import com.work.proof.core.repository.ProofMarketStore;
import com.work.proof.core.statemachine.ProofRequestTransitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.work.proof.core.support.ValidationUtils.requireNonNull;

/**
 * 门面（Facade）层：证明请求的生命周期状态机、expiry queue、准入控制与付款。
 * <p>
 * 单写者模型：所有操作（包括查询）在同一把锁下串行执行，保证轮转指派与准入计算的确定性。
 * 每个写操作要么整体成功，要么不留下任何写入；事件只在整体成功后发布。
 */
public class ProofManager {

    private static final Logger log = LoggerFactory.getLogger(ProofManager.class);

    private final ProofManagerConfig config;
    private final ProofMarketStore store;
    private final EscrowLedger escrow;
    private final AccessControl accessControl;
    private final Clock clock;
    private final ProofMarketEventPublisher events;

    private final ExpiryQueue expiryQueue = new ExpiryQueue();
    private final ProvingNetworkRegistry registry;
    private final AdmissionController admission;
    private final ReentrantLock lock = new ReentrantLock();

    public ProofManager(ProofManagerConfig config,
                        ProofMarketStore store,
                        EscrowLedger escrow,
                        AccessControl accessControl,
                        Clock clock,
                        ProofMarketEventPublisher events,
                        String fermahAddress,
                        String lagrangeAddress) {
        this.config = requireNonNull(config, "config");
        this.store = requireNonNull(store, "store");
        this.escrow = requireNonNull(escrow, "escrow");
        this.accessControl = requireNonNull(accessControl, "accessControl");
        this.clock = requireNonNull(clock, "clock");
        this.events = events == null ? ProofMarketEventPublisher.NOOP : events;
        this.registry = new ProvingNetworkRegistry(store);
        this.admission = new AdmissionController(config, store, escrow, registry, expiryQueue);
        store.inTransaction(() -> {
            registry.initialize(fermahAddress, lagrangeAddress);
            return null;
        });
        rebuildExpiryQueue();
    }

    // ------------------------------------------------------------------ submitter

    /**
     * 提交证明请求。先机会性 purge，再做准入检查，最后按轮转策略指派网络。
     * 指派结果为 NONE 或 INACTIVE 网络时直接创建为 REFUSED，不进入 expiry queue。
     */
    public ProofRequest submit(String caller, ProofRequestId id, ProofRequestParams params) {
        requireNonNull(id, "id");
        requireNonNull(params, "params");
        return execute("submit", emitted -> {
            requireRole(caller, Role.SUBMITTER);
            if (store.existsRequest(id)) {
                throw new InvalidRequestException(ErrorCode.DUPLICATE_REQUEST, "proof request already exists: " + id);
            }
            long timeoutAfter = params.getTimeoutAfter();
            if (timeoutAfter <= config.getAckTimeoutSeconds() || timeoutAfter > config.getMaxTimeoutAfterSeconds()) {
                throw new InvalidRequestException(ErrorCode.INVALID_TIMEOUT, "timeoutAfter must be in ("
                        + config.getAckTimeoutSeconds() + ", " + config.getMaxTimeoutAfterSeconds() + "]: " + timeoutAfter);
            }
            BigInteger maxReward = params.getMaxReward();
            if (maxReward.signum() <= 0 || maxReward.compareTo(config.getMaxRewardPerProof()) > 0) {
                throw new InvalidRequestException(ErrorCode.REWARD_OUT_OF_BOUNDS, "maxReward must be in (0, "
                        + config.getMaxRewardPerProof() + "]: " + maxReward);
            }

            long now = now();
            List<ProofRequest> purged = admission.purgeExpired(now);
            admission.requireCapacity();
            for (ProofRequest expired : purged) {
                store.updateRequest(expired);
                emitted.add(new ProofRequestExpiredEvent(now, expired.getAssignedTo(), expired.getId(), expired.getStatus()));
            }

            MarketState state = store.loadState();
            long requestId = state.getRequestCounter();
            ProvingNetwork assignee = AssignmentPolicy.assign(requestId, state.getPreferredNetwork());
            boolean refused = !registry.isActive(assignee);
            ProofRequestStatus status = refused ? ProofRequestStatus.REFUSED : ProofRequestStatus.PENDING_ACKNOWLEDGEMENT;

            ProofRequest request = ProofRequest.create(id, params, now, assignee, requestId, status);
            state.setRequestCounter(requestId + 1);
            store.saveState(state);
            store.insertRequest(request);
            if (!refused) {
                expiryQueue.insert(request.ackDeadline(config.getAckTimeoutSeconds()), id);
            }
            emitted.add(new ProofRequestSubmittedEvent(request));
            log.info("proof request submitted id={} requestId={} assignedTo={} status={}", id, requestId, assignee, status);
            return request;
        });
    }

    /**
     * 上报验证结果：PROVEN -> VALIDATED（累加网络应付奖励）或 VALIDATION_FAILED，两种情况都释放潜在奖励。
     */
    public ProofRequest submitValidationResult(String caller, ProofRequestId id, boolean valid) {
        requireNonNull(id, "id");
        return execute("submitValidationResult", emitted -> {
            requireRole(caller, Role.SUBMITTER);
            ProofRequest request = load(id);
            ProofRequestStatus target = valid ? ProofRequestStatus.VALIDATED : ProofRequestStatus.VALIDATION_FAILED;
            ProofRequestTransitions.requireAllowedForSubmitter(request.getStatus(), target);

            MarketState state = store.loadState();
            AdmissionController.releasePotentialReward(state, request.getRequestedReward());

            request.setStatus(target);
            store.updateRequest(request);
            if (valid) {
                registry.accrueReward(request.getAssignedTo(), request.getRequestedReward());
            }
            store.saveState(state);

            long now = now();
            emitted.add(new ValidationResultEvent(now, request.getAssignedTo(), id, valid));
            log.info("validation result id={} network={} valid={} reward={}", id, request.getAssignedTo(), valid,
                    request.getRequestedReward());
            return request;
        });
    }

    // ------------------------------------------------------------------ proving network

    /**
     * 受派网络在确认窗口内接受（COMMITTED，队列 key 改为证明截止时间）或拒绝（REFUSED，移出队列）。
     */
    public ProofRequest acknowledge(String caller, ProofRequestId id, boolean accept) {
        requireNonNull(id, "id");
        return execute("acknowledge", emitted -> {
            ProofRequest request = load(id);
            requireAssignee(caller, request);
            ProofRequestStatus target = accept ? ProofRequestStatus.COMMITTED : ProofRequestStatus.REFUSED;
            if (request.getStatus() != ProofRequestStatus.PENDING_ACKNOWLEDGEMENT) {
                throw new IllegalTransitionException(request.getStatus(), target);
            }
            long now = now();
            long deadline = request.ackDeadline(config.getAckTimeoutSeconds());
            if (now > deadline) {
                throw new DeadlinePassedException(ErrorCode.ACK_DEADLINE_PASSED, deadline, now);
            }
            ProofRequestTransitions.requireAllowed(request.getStatus(), target);

            if (accept) {
                expiryQueue.rekey(id, request.provingDeadline());
            } else {
                expiryQueue.removeByKey(id);
            }
            request.setStatus(target);
            store.updateRequest(request);
            emitted.add(new ProofRequestAcknowledgedEvent(now, request.getAssignedTo(), id, accept));
            log.info("proof request acknowledged id={} network={} accepted={}", id, request.getAssignedTo(), accept);
            return request;
        });
    }

    /**
     * 受派网络在证明窗口内提交 proof。requestedReward 截断到 maxReward。
     */
    public ProofRequest submitProof(String caller, ProofRequestId id, byte[] proof, BigInteger requestedReward) {
        requireNonNull(id, "id");
        return execute("submitProof", emitted -> {
            ProofRequest request = load(id);
            requireAssignee(caller, request);
            if (request.getStatus() != ProofRequestStatus.COMMITTED) {
                throw new IllegalTransitionException(request.getStatus(), ProofRequestStatus.PROVEN);
            }
            long now = now();
            long deadline = request.provingDeadline();
            if (now > deadline) {
                throw new DeadlinePassedException(ErrorCode.PROVING_DEADLINE_PASSED, deadline, now);
            }
            if (proof == null || proof.length == 0) {
                throw new InvalidRequestException(ErrorCode.EMPTY_PROOF, "proof must not be empty: " + id);
            }
            if (requestedReward == null || requestedReward.signum() < 0) {
                throw new InvalidRequestException(ErrorCode.REWARD_OUT_OF_BOUNDS, "requestedReward must be non-negative");
            }
            ProofRequestTransitions.requireAllowed(request.getStatus(), ProofRequestStatus.PROVEN);

            BigInteger reward = requestedReward.min(request.getMaxReward());
            request.setStatus(ProofRequestStatus.PROVEN);
            request.setProof(proof);
            request.setRequestedReward(reward);
            expiryQueue.removeByKey(id);
            store.updateRequest(request);

            MarketState state = store.loadState();
            AdmissionController.accruePotentialReward(state, reward);
            store.saveState(state);

            emitted.add(new ProofRequestProvenEvent(now, request.getAssignedTo(), id, proof, reward));
            log.info("proof submitted id={} network={} requestedReward={}", id, request.getAssignedTo(), reward);
            return request;
        });
    }

    /**
     * 一次性领取全部应付奖励，转账确认后才扣减 owedReward 并把纳入本次转账的 VALIDATED 请求标为 PAID。
     * <p>
     * 分三步执行，链上等待不占用存储事务：
     * 1. 事务内校验并签名转账，先持久化待确认记录（reference + 已签名交易），再提交；
     * 2. 事务外广播并等待回执；
     * 3. 事务内按结果结算（确认）或撤销待确认记录（确定失败）。
     * 结果未知时保留待确认记录并抛 PAYOUT_PENDING；再次领取时先按 reference 对账、原样重发同一笔交易，
     * 不会签出第二笔转账。
     *
     * @return 本次确认转出的金额
     */
    public BigInteger claimReward(String caller) {
        lock.lock();
        try {
            Payout payout = execute("claimReward", emitted -> openPayout(caller, emitted));
            if (payout.settled) {
                return payout.transfer.getAmount();
            }
            PreparedTransfer transfer = payout.transfer;
            boolean accepted = broadcastQuietly(transfer);
            if (!accepted && !payout.resumed) {
                execute("claimReward", emitted -> {
                    abandonPayout(payout.network, transfer);
                    return null;
                });
                throw new TransferFailedException("escrow transfer rejected to " + transfer.getTo()
                        + " amount " + transfer.getAmount());
            }

            TransferStatus outcome = awaitQuietly(transfer.getReference());
            if (outcome == TransferStatus.PENDING) {
                log.warn("payout outcome unknown network={} reference={} amount={}", payout.network,
                        transfer.getReference(), transfer.getAmount());
                throw new ProofManagerException(ErrorCode.PAYOUT_PENDING, "payout " + transfer.getReference()
                        + " for " + payout.network + " not confirmed yet");
            }
            execute("claimReward", emitted -> {
                if (outcome == TransferStatus.CONFIRMED) {
                    completePayout(payout.network, transfer, emitted);
                } else {
                    abandonPayout(payout.network, transfer);
                }
                return null;
            });
            if (outcome == TransferStatus.FAILED) {
                throw new TransferFailedException("escrow transfer failed to " + transfer.getTo()
                        + " reference " + transfer.getReference());
            }
            return transfer.getAmount();
        } finally {
            lock.unlock();
        }
    }

    private Payout openPayout(String caller, List<ProofMarketEvent> emitted) {
        ProvingNetwork network = registry.findByAddress(caller)
                .orElseThrow(() -> new UnauthorizedException(ErrorCode.UNAUTHORIZED,
                        "caller is not a registered proving network: " + caller));
        ProvingNetworkInfo info = registry.get(network);
        PreparedTransfer pending = info.getPendingPayout();
        if (pending != null) {
            TransferStatus status = checkQuietly(pending.getReference());
            if (status == TransferStatus.CONFIRMED) {
                completePayout(network, pending, emitted);
                return new Payout(network, pending, true, false);
            }
            if (status == TransferStatus.PENDING) {
                log.info("resuming pending payout network={} reference={}", network, pending.getReference());
                return new Payout(network, pending, false, true);
            }
            abandonPayout(network, pending);
            info = registry.get(network);
        }

        BigInteger owed = info.getOwedReward();
        if (owed.signum() <= 0) {
            throw new FundsUnavailableException(ErrorCode.NO_PAYMENT_DUE, "no payment due for " + network);
        }
        BigInteger balance = escrow.balanceOf(config.getEscrowAddress());
        if (balance == null || balance.compareTo(owed) < 0) {
            throw new FundsUnavailableException(ErrorCode.INSUFFICIENT_FUNDS,
                    "escrow balance " + balance + " below owed " + owed + " for " + network);
        }
        PreparedTransfer transfer;
        try {
            transfer = escrow.prepareTransfer(info.getAddress(), owed);
        } catch (RuntimeException e) {
            log.warn("escrow transfer preparation failed to={} amount={} err={}", info.getAddress(), owed, e.toString());
            throw new TransferFailedException("escrow transfer failed to " + info.getAddress() + ": " + e.getMessage(), e);
        }

        registry.beginPayout(network, transfer);
        for (ProofRequest r : store.findByAssigneeAndStatus(network, ProofRequestStatus.VALIDATED)) {
            if (r.getPayoutReference() == null) {
                r.setPayoutReference(transfer.getReference());
                store.updateRequest(r);
            }
        }
        log.info("payout prepared network={} reference={} amount={}", network, transfer.getReference(), owed);
        return new Payout(network, transfer, false, false);
    }

    private void completePayout(ProvingNetwork network, PreparedTransfer transfer, List<ProofMarketEvent> emitted) {
        registry.completePayout(network, transfer);
        int proofs = 0;
        for (ProofRequest r : store.findByAssigneeAndStatus(network, ProofRequestStatus.VALIDATED)) {
            if (transfer.getReference().equals(r.getPayoutReference())) {
                ProofRequestTransitions.requireAllowed(r.getStatus(), ProofRequestStatus.PAID);
                r.setStatus(ProofRequestStatus.PAID);
                store.updateRequest(r);
                proofs++;
            }
        }
        emitted.add(new RewardPaidEvent(now(), network, transfer.getTo(), transfer.getAmount()));
        log.info("reward paid network={} address={} amount={} reference={} proofs={}", network, transfer.getTo(),
                transfer.getAmount(), transfer.getReference(), proofs);
    }

    private void abandonPayout(ProvingNetwork network, PreparedTransfer transfer) {
        registry.abandonPayout(network, transfer);
        for (ProofRequest r : store.findByAssigneeAndStatus(network, ProofRequestStatus.VALIDATED)) {
            if (transfer.getReference().equals(r.getPayoutReference())) {
                r.setPayoutReference(null);
                store.updateRequest(r);
            }
        }
        log.warn("payout abandoned network={} reference={} amount={}", network, transfer.getReference(),
                transfer.getAmount());
    }

    /**
     * 广播异常时无法判断节点是否已收到交易，按“可能已广播”处理，结果交给回执对账。
     */
    private boolean broadcastQuietly(PreparedTransfer transfer) {
        try {
            return escrow.broadcast(transfer);
        } catch (RuntimeException e) {
            log.warn("escrow broadcast error reference={} err={}", transfer.getReference(), e.toString());
            return true;
        }
    }

    private TransferStatus awaitQuietly(String reference) {
        try {
            return escrow.awaitTransfer(reference);
        } catch (RuntimeException e) {
            log.warn("escrow receipt wait error reference={} err={}", reference, e.toString());
            return TransferStatus.PENDING;
        }
    }

    private TransferStatus checkQuietly(String reference) {
        try {
            return escrow.checkTransfer(reference);
        } catch (RuntimeException e) {
            log.warn("escrow receipt lookup error reference={} err={}", reference, e.toString());
            return TransferStatus.PENDING;
        }
    }

    private static final class Payout {
        final ProvingNetwork network;
        final PreparedTransfer transfer;
        final boolean settled;
        final boolean resumed;

        Payout(ProvingNetwork network, PreparedTransfer transfer, boolean settled, boolean resumed) {
            this.network = network;
            this.transfer = transfer;
            this.settled = settled;
            this.resumed = resumed;
        }
    }

    // ------------------------------------------------------------------ admin

    public ProvingNetworkInfo setNetworkAddress(String caller, ProvingNetwork network, String address) {
        return execute("setNetworkAddress", emitted -> {
            requireRole(caller, Role.ADMIN);
            ProvingNetworkInfo info = registry.setAddress(network, address);
            emitted.add(new NetworkAddressChangedEvent(now(), network, info.getAddress()));
            log.info("proving network address updated network={} address={}", network, info.getAddress());
            return info;
        });
    }

    public ProvingNetworkInfo setNetworkStatus(String caller, ProvingNetwork network, ProvingNetworkStatus status) {
        return execute("setNetworkStatus", emitted -> {
            requireRole(caller, Role.ADMIN);
            ProvingNetworkInfo info = registry.setStatus(network, status);
            emitted.add(new NetworkStatusChangedEvent(now(), network, status));
            log.info("proving network status updated network={} status={}", network, status);
            return info;
        });
    }

    public ProvingNetwork setPreferredNetwork(String caller, ProvingNetwork network) {
        return execute("setPreferredNetwork", emitted -> {
            requireRole(caller, Role.ADMIN);
            registry.setPreferred(network);
            emitted.add(new PreferredNetworkChangedEvent(now(), network));
            log.info("preferred network updated network={}", network);
            return network;
        });
    }

    // ------------------------------------------------------------------ queries

    /**
     * 按 id 查询。返回的是副本，其 status 为懒计算后的视图状态
     * （已过确认/证明截止时间但尚未被 purge 的请求报告为 UNACKNOWLEDGED / TIMED_OUT）。
     */
    public Optional<ProofRequest> getRequest(ProofRequestId id) {
        requireNonNull(id, "id");
        return query(() -> store.findRequest(id).map(r -> {
            r.setStatus(r.effectiveStatus(now(), config.getAckTimeoutSeconds()));
            return r;
        }));
    }

    public ProofRequestStatus getRequestStatus(ProofRequestId id) {
        return getRequest(id).map(ProofRequest::getStatus).orElseThrow(() -> new RequestNotFoundException(id));
    }

    public ProvingNetworkInfo getNetwork(ProvingNetwork network) {
        return query(() -> registry.get(network));
    }

    public Optional<ProvingNetwork> findNetworkByAddress(String address) {
        return query(() -> registry.findByAddress(address));
    }

    public ProvingNetwork getPreferredNetwork() {
        return query(registry::getPreferred);
    }

    public EscrowObligations getObligations() {
        return query(admission::obligations);
    }

    public int inFlightCount() {
        return query(expiryQueue::size);
    }

    // ------------------------------------------------------------------ internals

    /**
     * 以存储中的持久化状态为准重建 expiry queue（启动时、以及失败操作动过队列之后）。
     */
    void rebuildExpiryQueue() {
        lock.lock();
        try {
            expiryQueue.clear();
            for (ProofRequest r : store.findExpirable()) {
                long expiry = r.getStatus() == ProofRequestStatus.PENDING_ACKNOWLEDGEMENT
                        ? r.ackDeadline(config.getAckTimeoutSeconds())
                        : r.provingDeadline();
                expiryQueue.insert(expiry, r.getId());
            }
            log.info("expiry queue rebuilt size={}", expiryQueue.size());
        } finally {
            lock.unlock();
        }
    }

    private <T> T execute(String op, Function<List<ProofMarketEvent>, T> work) {
        lock.lock();
        try {
            List<ProofMarketEvent> emitted = new ArrayList<>();
            long queueVersion = expiryQueue.modCount();
            T result;
            try {
                result = store.inTransaction(() -> work.apply(emitted));
            } catch (RuntimeException ex) {
                if (expiryQueue.modCount() != queueVersion) {
                    rebuildExpiryQueue();
                }
                log.debug("{} rejected: {}", op, ex.toString());
                throw ex;
            }
            for (ProofMarketEvent e : emitted) {
                publishSafely(e);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private <T> T query(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private void publishSafely(ProofMarketEvent event) {
        try {
            events.publish(event);
        } catch (RuntimeException e) {
            // 操作已提交，发布失败只记录
            log.warn("event publish failed type={} err={}", event.getType(), e.toString());
        }
    }

    private ProofRequest load(ProofRequestId id) {
        return store.findRequest(id).orElseThrow(() -> new RequestNotFoundException(id));
    }

    private void requireRole(String caller, Role role) {
        if (!accessControl.hasRole(caller, role)) {
            throw new UnauthorizedException(ErrorCode.UNAUTHORIZED, "caller " + caller + " lacks role " + role);
        }
    }

    private void requireAssignee(String caller, ProofRequest request) {
        ProvingNetwork assignee = request.getAssignedTo();
        Optional<ProvingNetwork> callerNetwork = registry.findByAddress(caller);
        if (!assignee.isReal() || !callerNetwork.isPresent() || callerNetwork.get() != assignee) {
            throw new UnauthorizedException(ErrorCode.ONLY_ASSIGNEE,
                    "caller " + caller + " is not the assignee " + assignee + " of " + request.getId());
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
