package com.work.proof.core.model;

public enum ProvingNetworkStatus {
    ACTIVE,
    INACTIVE
}
