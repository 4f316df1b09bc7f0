package com.work.proof.app.web.dto;

import com.work.proof.core.model.ProvingNetwork;

import javax.validation.constraints.NotNull;

/**
 * 设置偏好网络，允许 NONE。
 */
public class PreferredNetworkRequest {

    @NotNull(message = "network 不能为空")
    private ProvingNetwork network;

    public ProvingNetwork getNetwork() {
        return network;
    }

    public void setNetwork(ProvingNetwork network) {
        this.network = network;
    }
}
