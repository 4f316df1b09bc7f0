package com.work.proof.core.escrow;

/**
 * 一笔已广播（或可能已广播）转账的链上结果。
 */
public enum TransferStatus {
    /**
     * 已上链且执行成功，资金已转出。
     */
    CONFIRMED,
    /**
     * 确定未转出：节点拒绝、回执 status=0x0，或该交易从未被广播。
     */
    FAILED,
    /**
     * 结果未知（等待回执超时、RPC 不可用）。资金可能已经转出，不能据此重发新交易。
     */
    PENDING
}
