package com.work.proof.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.proof.core.repository.entity.ProvingNetworkEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 证明网络登记表 Mapper
 */
public interface ProvingNetworkMapper extends BaseMapper<ProvingNetworkEntity> {

    @Insert("INSERT INTO proving_network(network, address, status, owed_reward, " +
            "payout_reference, payout_recipient, payout_amount, payout_payload, updated_at) " +
            "VALUES(#{network}, #{address}, #{status}, #{owedReward}, " +
            "#{payoutReference}, #{payoutRecipient}, #{payoutAmount}, #{payoutPayload}, #{updatedAt}) " +
            "ON CONFLICT(network) DO UPDATE SET address = #{address}, status = #{status}, " +
            "owed_reward = #{owedReward}, payout_reference = #{payoutReference}, payout_recipient = #{payoutRecipient}, " +
            "payout_amount = #{payoutAmount}, payout_payload = #{payoutPayload}, updated_at = #{updatedAt}")
    int upsert(@Param("network") String network,
               @Param("address") String address,
               @Param("status") String status,
               @Param("owedReward") BigInteger owedReward,
               @Param("payoutReference") String payoutReference,
               @Param("payoutRecipient") String payoutRecipient,
               @Param("payoutAmount") BigInteger payoutAmount,
               @Param("payoutPayload") String payoutPayload,
               @Param("updatedAt") Instant updatedAt);
}
