package com.work.proof.core.escrow;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 已签名、尚未（或不确定是否）广播的转账。
 * <p>
 * reference 在广播前就已确定（链上实现即交易哈希），payload 为可原样重发的已签名交易；
 * 同一个 payload 重发多次最多只会上链一次。
 */
public class PreparedTransfer {

    private final String reference;
    private final String to;
    private final BigInteger amount;
    private final String payload;

    public PreparedTransfer(String reference, String to, BigInteger amount, String payload) {
        if (reference == null || reference.trim().isEmpty()) {
            throw new IllegalArgumentException("reference 不能为空");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount 不能为负数");
        }
        this.reference = reference;
        this.to = to;
        this.amount = amount;
        this.payload = payload;
    }

    public String getReference() {
        return reference;
    }

    public String getTo() {
        return to;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return reference.equals(((PreparedTransfer) o).reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference);
    }

    @Override
    public String toString() {
        return "PreparedTransfer{reference=" + reference + ", to=" + to + ", amount=" + amount + '}';
    }
}
