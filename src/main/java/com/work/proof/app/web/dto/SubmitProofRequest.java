package com.work.proof.app.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;

/**
 * 提交证明。proof 为 0x 前缀的 hex 字符串。
 */
public class SubmitProofRequest {

    @NotNull(message = "proof 不能为空")
    @Pattern(regexp = "^(0x)?[0-9a-fA-F]*$", message = "proof 必须为 hex 字符串")
    private String proof;

    @NotBlank(message = "requestedReward 不能为空")
    @Pattern(regexp = "\\d+", message = "requestedReward 必须为非负整数")
    private String requestedReward;

    public String getProof() {
        return proof;
    }

    public void setProof(String proof) {
        this.proof = proof;
    }

    public String getRequestedReward() {
        return requestedReward;
    }

    public void setRequestedReward(String requestedReward) {
        this.requestedReward = requestedReward;
    }
}
