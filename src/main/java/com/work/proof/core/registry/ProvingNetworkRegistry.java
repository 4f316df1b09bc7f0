package com.work.proof.core.registry;

import com.work.proof.core.escrow.PreparedTransfer;
import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.InvalidRequestException;
import com.work.proof.core.exception.ProofManagerException;
import com.work.proof.core.model.MarketState;
import com.work.proof.core.model.ProvingNetwork;
import com.work.proof.core.model.ProvingNetworkInfo;
import com.work.proof.core.model.ProvingNetworkStatus;
import com.work.proof.core.repository.ProofMarketStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

import static com.work.proof.core.support.ValidationUtils.isZeroAddress;
import static com.work.proof.core.support.ValidationUtils.requireAddress;
import static com.work.proof.core.support.ValidationUtils.requireNonNull;

/**
 * 证明网络登记表：地址、启用状态、已验证未领取的奖励，以及偏好网络。
 * <p>
 * 只做参数与不变量校验，角色校验由 ProofManager 在操作入口完成。
 */
public class ProvingNetworkRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProvingNetworkRegistry.class);

    private static final ProvingNetwork[] REAL_NETWORKS = {ProvingNetwork.FERMAH, ProvingNetwork.LAGRANGE};

    private final ProofMarketStore store;

    public ProvingNetworkRegistry(ProofMarketStore store) {
        this.store = requireNonNull(store, "store");
    }

    /**
     * 首次启动时登记两个网络（默认 ACTIVE）；已登记的网络保持存储中的值。
     */
    public void initialize(String fermahAddress, String lagrangeAddress) {
        String fermah = requireNetworkAddress(fermahAddress);
        String lagrange = requireNetworkAddress(lagrangeAddress);
        if (fermah.equals(lagrange)) {
            throw new InvalidRequestException(ErrorCode.INVALID_ADDRESS, "networks must not share an address");
        }
        initializeOne(ProvingNetwork.FERMAH, fermah);
        initializeOne(ProvingNetwork.LAGRANGE, lagrange);
    }

    private void initializeOne(ProvingNetwork network, String address) {
        if (!store.findNetwork(network).isPresent()) {
            store.saveNetwork(new ProvingNetworkInfo(network, address, ProvingNetworkStatus.ACTIVE, BigInteger.ZERO));
            log.info("registered proving network {} address={}", network, address);
        }
    }

    public ProvingNetworkInfo get(ProvingNetwork network) {
        requireReal(network);
        return store.findNetwork(network)
                .orElseThrow(() -> new ProofManagerException(ErrorCode.INVARIANT_VIOLATED,
                        "proving network not registered: " + network));
    }

    public Optional<ProvingNetwork> findByAddress(String address) {
        if (address == null || address.trim().isEmpty()) {
            return Optional.empty();
        }
        String normalized = address.trim().toLowerCase(Locale.ROOT);
        for (ProvingNetwork n : REAL_NETWORKS) {
            Optional<ProvingNetworkInfo> info = store.findNetwork(n);
            if (info.isPresent() && normalized.equals(info.get().getAddress())) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    public boolean isActive(ProvingNetwork network) {
        return network != null && network.isReal() && get(network).isActive();
    }

    public ProvingNetworkInfo setAddress(ProvingNetwork network, String address) {
        requireReal(network);
        String normalized = requireNetworkAddress(address);
        for (ProvingNetwork other : REAL_NETWORKS) {
            if (other != network && normalized.equals(get(other).getAddress())) {
                throw new InvalidRequestException(ErrorCode.INVALID_ADDRESS,
                        "address already registered for " + other + ": " + normalized);
            }
        }
        ProvingNetworkInfo info = get(network);
        info.setAddress(normalized);
        store.saveNetwork(info);
        return info;
    }

    public ProvingNetworkInfo setStatus(ProvingNetwork network, ProvingNetworkStatus status) {
        requireReal(network);
        if (status == null) {
            throw new InvalidRequestException(ErrorCode.INVALID_NETWORK, "status must not be null");
        }
        ProvingNetworkInfo info = get(network);
        info.setStatus(status);
        store.saveNetwork(info);
        return info;
    }

    public ProvingNetwork getPreferred() {
        return store.loadState().getPreferredNetwork();
    }

    /**
     * 偏好网络允许任意值（包括 NONE）。
     */
    public void setPreferred(ProvingNetwork network) {
        if (network == null) {
            throw new InvalidRequestException(ErrorCode.INVALID_NETWORK, "preferred network must not be null");
        }
        MarketState state = store.loadState();
        state.setPreferredNetwork(network);
        store.saveState(state);
    }

    /**
     * 验证通过后累加应付奖励，领取转账确认后按实付金额扣减。
     */
    public void accrueReward(ProvingNetwork network, BigInteger amount) {
        ProvingNetworkInfo info = get(network);
        info.setOwedReward(info.getOwedReward().add(amount));
        store.saveNetwork(info);
    }

    public void beginPayout(ProvingNetwork network, PreparedTransfer transfer) {
        requireNonNull(transfer, "transfer");
        ProvingNetworkInfo info = get(network);
        if (info.getPendingPayout() != null) {
            throw new ProofManagerException(ErrorCode.INVARIANT_VIOLATED,
                    "payout already pending for " + network + ": " + info.getPendingPayout().getReference());
        }
        info.setPendingPayout(transfer);
        store.saveNetwork(info);
    }

    /**
     * 领取转账已确认：扣减应付奖励并清除待确认记录。
     */
    public void completePayout(ProvingNetwork network, PreparedTransfer transfer) {
        ProvingNetworkInfo info = requirePendingPayout(network, transfer);
        BigInteger next = info.getOwedReward().subtract(transfer.getAmount());
        if (next.signum() < 0) {
            throw new ProofManagerException(ErrorCode.INVARIANT_VIOLATED,
                    "owed reward underflow for " + network + ": owed=" + info.getOwedReward() + " paid=" + transfer.getAmount());
        }
        info.setOwedReward(next);
        info.setPendingPayout(null);
        store.saveNetwork(info);
    }

    /**
     * 领取转账确定失败：只清除待确认记录，应付奖励保持不变。
     */
    public void abandonPayout(ProvingNetwork network, PreparedTransfer transfer) {
        ProvingNetworkInfo info = requirePendingPayout(network, transfer);
        info.setPendingPayout(null);
        store.saveNetwork(info);
    }

    private ProvingNetworkInfo requirePendingPayout(ProvingNetwork network, PreparedTransfer transfer) {
        ProvingNetworkInfo info = get(network);
        if (info.getPendingPayout() == null || !info.getPendingPayout().equals(transfer)) {
            throw new ProofManagerException(ErrorCode.INVARIANT_VIOLATED,
                    "no pending payout " + transfer.getReference() + " for " + network);
        }
        return info;
    }

    public BigInteger totalOwedReward() {
        BigInteger total = BigInteger.ZERO;
        for (ProvingNetwork n : REAL_NETWORKS) {
            total = total.add(get(n).getOwedReward());
        }
        return total;
    }

    private static void requireReal(ProvingNetwork network) {
        if (network == null || !network.isReal()) {
            throw new InvalidRequestException(ErrorCode.INVALID_NETWORK, "invalid proving network: " + network);
        }
    }

    private static String requireNetworkAddress(String address) {
        String normalized;
        try {
            normalized = requireAddress(address, "address");
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(ErrorCode.INVALID_ADDRESS, e.getMessage());
        }
        if (isZeroAddress(normalized)) {
            throw new InvalidRequestException(ErrorCode.INVALID_ADDRESS, "address must not be the zero address");
        }
        return normalized;
    }
}
