package com.work.proof.app.web.dto;

import java.util.Map;

/**
 * 托管资金占用快照：余额、各网络应付、潜在奖励与在途请求数。
 */
public class ObligationsView {

    private String escrowBalance;
    private Map<String, String> owedByNetwork;
    private String owedReward;
    private String potentialFutureReward;
    private String totalObligations;
    private int inFlight;
    private String requestSlots;
    private boolean acceptingRequests;

    public String getEscrowBalance() {
        return escrowBalance;
    }

    public void setEscrowBalance(String escrowBalance) {
        this.escrowBalance = escrowBalance;
    }

    public Map<String, String> getOwedByNetwork() {
        return owedByNetwork;
    }

    public void setOwedByNetwork(Map<String, String> owedByNetwork) {
        this.owedByNetwork = owedByNetwork;
    }

    public String getOwedReward() {
        return owedReward;
    }

    public void setOwedReward(String owedReward) {
        this.owedReward = owedReward;
    }

    public String getPotentialFutureReward() {
        return potentialFutureReward;
    }

    public void setPotentialFutureReward(String potentialFutureReward) {
        this.potentialFutureReward = potentialFutureReward;
    }

    public String getTotalObligations() {
        return totalObligations;
    }

    public void setTotalObligations(String totalObligations) {
        this.totalObligations = totalObligations;
    }

    public int getInFlight() {
        return inFlight;
    }

    public void setInFlight(int inFlight) {
        this.inFlight = inFlight;
    }

    public String getRequestSlots() {
        return requestSlots;
    }

    public void setRequestSlots(String requestSlots) {
        this.requestSlots = requestSlots;
    }

    public boolean isAcceptingRequests() {
        return acceptingRequests;
    }

    public void setAcceptingRequests(boolean acceptingRequests) {
        this.acceptingRequests = acceptingRequests;
    }
}
