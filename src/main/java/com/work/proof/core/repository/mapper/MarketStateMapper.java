package com.work.proof.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.proof.core.repository.entity.MarketStateEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;

/**
 * 全局标量状态表 Mapper
 */
public interface MarketStateMapper extends BaseMapper<MarketStateEntity> {

    /**
     * 以 {@code SELECT ... FOR UPDATE} 的语义读取单行状态
     */
    @Select("SELECT id, request_counter, preferred_network, potential_future_reward, updated_at " +
            "FROM market_state WHERE id = 1 FOR UPDATE")
    MarketStateEntity lockAndLoad();

    @Insert("INSERT INTO market_state(id, request_counter, preferred_network, potential_future_reward, updated_at) " +
            "VALUES(1, 0, 'NONE', 0, #{now}) ON CONFLICT(id) DO NOTHING")
    int insertIfNotExists(@Param("now") Instant now);
}
