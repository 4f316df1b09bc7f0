package com.work.proof.app.web.dto;

import com.work.proof.core.model.ProvingNetworkStatus;

import javax.validation.constraints.NotNull;

public class UpdateStatusRequest {

    @NotNull(message = "status 不能为空")
    private ProvingNetworkStatus status;

    public ProvingNetworkStatus getStatus() {
        return status;
    }

    public void setStatus(ProvingNetworkStatus status) {
        this.status = status;
    }
}
