package com.work.proof.core.admission;

import java.math.BigInteger;

/**
 * 托管资金与未结义务的快照。
 */
public class EscrowObligations {

    private final BigInteger escrowBalance;
    private final BigInteger owedReward;
    private final BigInteger potentialFutureReward;
    private final int inFlight;
    private final BigInteger maxRewardPerProof;

    public EscrowObligations(BigInteger escrowBalance,
                             BigInteger owedReward,
                             BigInteger potentialFutureReward,
                             int inFlight,
                             BigInteger maxRewardPerProof) {
        this.escrowBalance = escrowBalance;
        this.owedReward = owedReward;
        this.potentialFutureReward = potentialFutureReward;
        this.inFlight = inFlight;
        this.maxRewardPerProof = maxRewardPerProof;
    }

    public BigInteger getEscrowBalance() {
        return escrowBalance;
    }

    /**
     * 两个网络已验证未领取的奖励之和。
     */
    public BigInteger getOwedReward() {
        return owedReward;
    }

    public BigInteger getPotentialFutureReward() {
        return potentialFutureReward;
    }

    public int getInFlight() {
        return inFlight;
    }

    public BigInteger getTotalObligations() {
        return owedReward.add(potentialFutureReward);
    }

    /**
     * (balance - obligations) / maxRewardPerProof，余额不足以覆盖既有义务时为 0。
     */
    public BigInteger getRequestSlots() {
        BigInteger free = escrowBalance.subtract(getTotalObligations());
        if (free.signum() <= 0) {
            return BigInteger.ZERO;
        }
        return free.divide(maxRewardPerProof);
    }

    /**
     * 可用名额必须严格大于在途请求数。
     */
    public boolean canAcceptNewRequest() {
        return getRequestSlots().compareTo(BigInteger.valueOf(inFlight)) > 0;
    }

    @Override
    public String toString() {
        return "EscrowObligations{" +
                "escrowBalance=" + escrowBalance +
                ", owedReward=" + owedReward +
                ", potentialFutureReward=" + potentialFutureReward +
                ", inFlight=" + inFlight +
                '}';
    }
}
