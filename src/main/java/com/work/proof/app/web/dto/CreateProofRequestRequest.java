package com.work.proof.app.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;

/**
 * 提交证明请求。金额以十进制字符串传入（USDC 最小单位）。
 */
public class CreateProofRequestRequest {

    @NotNull(message = "chainId 不能为空")
    @Positive(message = "chainId 必须大于0")
    private Long chainId;

    @NotNull(message = "blockNumber 不能为空")
    @PositiveOrZero(message = "blockNumber 不能为负数")
    private Long blockNumber;

    @NotBlank(message = "proofInputsUrl 不能为空")
    private String proofInputsUrl;

    @NotNull(message = "protocolMajor 不能为空")
    @PositiveOrZero
    private Integer protocolMajor;

    @NotNull(message = "protocolMinor 不能为空")
    @PositiveOrZero
    private Integer protocolMinor;

    @NotNull(message = "protocolPatch 不能为空")
    @PositiveOrZero
    private Integer protocolPatch;

    /**
     * 相对提交时间的证明超时，单位秒
     */
    @NotNull(message = "timeoutAfter 不能为空")
    @PositiveOrZero
    private Long timeoutAfter;

    @NotBlank(message = "maxReward 不能为空")
    @Pattern(regexp = "\\d+", message = "maxReward 必须为非负整数")
    private String maxReward;

    public Long getChainId() {
        return chainId;
    }

    public void setChainId(Long chainId) {
        this.chainId = chainId;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }

    public void setBlockNumber(Long blockNumber) {
        this.blockNumber = blockNumber;
    }

    public String getProofInputsUrl() {
        return proofInputsUrl;
    }

    public void setProofInputsUrl(String proofInputsUrl) {
        this.proofInputsUrl = proofInputsUrl;
    }

    public Integer getProtocolMajor() {
        return protocolMajor;
    }

    public void setProtocolMajor(Integer protocolMajor) {
        this.protocolMajor = protocolMajor;
    }

    public Integer getProtocolMinor() {
        return protocolMinor;
    }

    public void setProtocolMinor(Integer protocolMinor) {
        this.protocolMinor = protocolMinor;
    }

    public Integer getProtocolPatch() {
        return protocolPatch;
    }

    public void setProtocolPatch(Integer protocolPatch) {
        this.protocolPatch = protocolPatch;
    }

    public Long getTimeoutAfter() {
        return timeoutAfter;
    }

    public void setTimeoutAfter(Long timeoutAfter) {
        this.timeoutAfter = timeoutAfter;
    }

    public String getMaxReward() {
        return maxReward;
    }

    public void setMaxReward(String maxReward) {
        this.maxReward = maxReward;
    }
}
