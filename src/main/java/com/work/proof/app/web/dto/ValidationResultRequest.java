package com.work.proof.app.web.dto;

import javax.validation.constraints.NotNull;

public class ValidationResultRequest {

    @NotNull(message = "valid 不能为空")
    private Boolean valid;

    public Boolean getValid() {
        return valid;
    }

    public void setValid(Boolean valid) {
        this.valid = valid;
    }
}
