package com.work.proof.app.web.dto;

import javax.validation.constraints.NotBlank;

public class UpdateAddressRequest {

    @NotBlank(message = "address 不能为空")
    private String address;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }
}
