package com.work.proof.core.model;

/**
 * 证明请求的复合主键 (chainId, blockNumber)，创建后不可变。
 */
public final class ProofRequestId implements Comparable<ProofRequestId> {

    private final long chainId;
    private final long blockNumber;

    public ProofRequestId(long chainId, long blockNumber) {
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId 必须大于0");
        }
        if (blockNumber < 0) {
            throw new IllegalArgumentException("blockNumber 不能为负数");
        }
        this.chainId = chainId;
        this.blockNumber = blockNumber;
    }

    public static ProofRequestId of(long chainId, long blockNumber) {
        return new ProofRequestId(chainId, blockNumber);
    }

    public long getChainId() {
        return chainId;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    @Override
    public int compareTo(ProofRequestId o) {
        int c = Long.compare(chainId, o.chainId);
        return c != 0 ? c : Long.compare(blockNumber, o.blockNumber);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProofRequestId that = (ProofRequestId) o;
        return chainId == that.chainId && blockNumber == that.blockNumber;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(chainId) + Long.hashCode(blockNumber);
    }

    @Override
    public String toString() {
        return chainId + "/" + blockNumber;
    }
}
