package com.work.proof.core.escrow;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.proof.core.support.ValidationUtils.requireAddress;
import static com.work.proof.core.support.ValidationUtils.requireNonNegative;
import static com.work.proof.core.support.ValidationUtils.requireNonNull;

/**
 * 纯内存实现，方便在没有链节点的环境下演示组件行为。
 * 广播即结算，重复广播同一 reference 不会重复扣款。
 * 注意：该实现仅用于 demo/测试，不具备跨进程一致性。
 */
public class InMemoryEscrowLedger implements EscrowLedger {

    private final String escrowAddress;
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<String, TransferStatus> outcomes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryEscrowLedger(String escrowAddress, BigInteger initialBalance) {
        this.escrowAddress = requireAddress(escrowAddress, "escrowAddress");
        balances.put(this.escrowAddress, requireNonNegative(initialBalance, "initialBalance"));
    }

    @Override
    public BigInteger balanceOf(String address) {
        return balances.getOrDefault(key(address), BigInteger.ZERO);
    }

    @Override
    public PreparedTransfer prepareTransfer(String to, BigInteger amount) {
        requireNonNegative(amount, "amount");
        return new PreparedTransfer("mem-" + sequence.incrementAndGet(), key(to), amount, null);
    }

    @Override
    public synchronized boolean broadcast(PreparedTransfer transfer) {
        requireNonNull(transfer, "transfer");
        TransferStatus previous = outcomes.get(transfer.getReference());
        if (previous != null) {
            return previous == TransferStatus.CONFIRMED;
        }
        BigInteger from = balanceOf(escrowAddress);
        if (from.compareTo(transfer.getAmount()) < 0) {
            outcomes.put(transfer.getReference(), TransferStatus.FAILED);
            return false;
        }
        balances.put(escrowAddress, from.subtract(transfer.getAmount()));
        balances.merge(key(transfer.getTo()), transfer.getAmount(), BigInteger::add);
        outcomes.put(transfer.getReference(), TransferStatus.CONFIRMED);
        return true;
    }

    @Override
    public TransferStatus awaitTransfer(String reference) {
        return checkTransfer(reference);
    }

    /**
     * 从未广播过的 reference 视为 FAILED。
     */
    @Override
    public TransferStatus checkTransfer(String reference) {
        TransferStatus status = reference == null ? null : outcomes.get(reference);
        return status == null ? TransferStatus.FAILED : status;
    }

    /**
     * 充值（模拟跨链桥入金）。
     */
    public synchronized void deposit(BigInteger amount) {
        requireNonNegative(amount, "amount");
        balances.merge(escrowAddress, amount, BigInteger::add);
    }

    private static String key(String address) {
        return address == null ? "" : address.trim().toLowerCase(Locale.ROOT);
    }
}
