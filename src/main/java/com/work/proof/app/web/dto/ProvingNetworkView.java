package com.work.proof.app.web.dto;

public class ProvingNetworkView {

    private String network;
    private String address;
    private String status;
    private String owedReward;

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getOwedReward() {
        return owedReward;
    }

    public void setOwedReward(String owedReward) {
        this.owedReward = owedReward;
    }
}
