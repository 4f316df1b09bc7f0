package com.work.proof.core.escrow;

import java.math.BigInteger;

/**
 * 托管资金端口（ERC-20 语义）。失败直接上报，组件内部不重试。
 * <p>
 * 转账拆成 prepare / broadcast / await 三步：调用方先持久化 {@link PreparedTransfer#getReference()}，
 * 再广播并等待结果。结果未知（{@link TransferStatus#PENDING}）时只能按 reference 对账或原样重发，
 * 不能重新签一笔新交易。
 */
public interface EscrowLedger {

    BigInteger balanceOf(String address);

    /**
     * 构造并签名一笔从托管地址到 {@code to} 的转账，不产生链上副作用。
     */
    PreparedTransfer prepareTransfer(String to, BigInteger amount);

    /**
     * 广播（或原样重发）已签名转账。
     *
     * @return false 表示节点明确拒绝；true 表示已接收或结果未知
     */
    boolean broadcast(PreparedTransfer transfer);

    /**
     * 阻塞等待转账结果，超时返回 {@link TransferStatus#PENDING}。
     */
    TransferStatus awaitTransfer(String reference);

    /**
     * 按 reference 查询一次当前结果，不等待。
     */
    TransferStatus checkTransfer(String reference);

    /**
     * 一步完成的转账。
     *
     * @return true 表示资金已确认转出
     */
    default boolean transfer(String to, BigInteger amount) {
        PreparedTransfer prepared = prepareTransfer(to, amount);
        return broadcast(prepared) && awaitTransfer(prepared.getReference()) == TransferStatus.CONFIRMED;
    }
}
