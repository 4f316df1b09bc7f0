package com.work.proof.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 全局标量状态表，只有 id=1 一行。
 */
@TableName("market_state")
public class MarketStateEntity {

    public static final int SINGLETON_ID = 1;

    @TableId(type = IdType.INPUT)
    private Integer id;

    private Long requestCounter;

    private String preferredNetwork;

    private BigInteger potentialFutureReward;

    private Instant updatedAt;

    public Integer getId() {
        return id;
    }

    public void setId(Integer id) {
        this.id = id;
    }

    public Long getRequestCounter() {
        return requestCounter;
    }

    public void setRequestCounter(Long requestCounter) {
        this.requestCounter = requestCounter;
    }

    public String getPreferredNetwork() {
        return preferredNetwork;
    }

    public void setPreferredNetwork(String preferredNetwork) {
        this.preferredNetwork = preferredNetwork;
    }

    public BigInteger getPotentialFutureReward() {
        return potentialFutureReward;
    }

    public void setPotentialFutureReward(BigInteger potentialFutureReward) {
        this.potentialFutureReward = potentialFutureReward;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
