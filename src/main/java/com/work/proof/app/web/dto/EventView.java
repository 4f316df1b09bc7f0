package com.work.proof.app.web.dto;

import java.util.Map;

/**
 * 事件 feed 中的一条记录；details 随事件类型不同而不同。
 */
public class EventView {

    private long seq;
    private String type;
    private long timestamp;
    private String network;
    private Map<String, Object> details;

    public long getSeq() {
        return seq;
    }

    public void setSeq(long seq) {
        this.seq = seq;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public void setDetails(Map<String, Object> details) {
        this.details = details;
    }
}
