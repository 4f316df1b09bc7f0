package com.work.proof.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.proof.core.repository.entity.ProofRequestEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 证明请求表 Mapper
 */
public interface ProofRequestMapper extends BaseMapper<ProofRequestEntity> {

    String COLUMNS = "request_id, chain_id, block_number, proof_inputs_url, protocol_major, protocol_minor, protocol_patch, " +
            "submitted_at, timeout_after, max_reward, assigned_to, status, requested_reward, proof, payout_reference, updated_at";

    @Select("SELECT " + COLUMNS + " FROM proof_request WHERE chain_id = #{chainId} AND block_number = #{blockNumber}")
    ProofRequestEntity findByChainAndBlock(@Param("chainId") long chainId, @Param("blockNumber") long blockNumber);

    @Select("SELECT COUNT(1) FROM proof_request WHERE chain_id = #{chainId} AND block_number = #{blockNumber}")
    int countByChainAndBlock(@Param("chainId") long chainId, @Param("blockNumber") long blockNumber);

    /**
     * 仍可能过期的请求（用于重建 expiry queue）
     */
    @Select("SELECT " + COLUMNS + " FROM proof_request " +
            "WHERE status IN ('PENDING_ACKNOWLEDGEMENT', 'COMMITTED') ORDER BY request_id ASC")
    List<ProofRequestEntity> listExpirable();

    @Select("SELECT " + COLUMNS + " FROM proof_request " +
            "WHERE assigned_to = #{assignedTo} AND status = #{status} ORDER BY request_id ASC")
    List<ProofRequestEntity> listByAssigneeAndStatus(@Param("assignedTo") String assignedTo, @Param("status") String status);
}
