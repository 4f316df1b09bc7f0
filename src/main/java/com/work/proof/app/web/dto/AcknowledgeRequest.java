package com.work.proof.app.web.dto;

import javax.validation.constraints.NotNull;

public class AcknowledgeRequest {

    @NotNull(message = "accept 不能为空")
    private Boolean accept;

    public Boolean getAccept() {
        return accept;
    }

    public void setAccept(Boolean accept) {
        this.accept = accept;
    }
}
