package com.work.proof.core.queue;

import com.work.proof.core.model.ProofRequestId;

/**
 * expiry queue 中的一条记录：(expiry, id)。
 */
public final class ExpiryEntry {

    private final long expiry;
    private final ProofRequestId id;

    public ExpiryEntry(long expiry, ProofRequestId id) {
        this.expiry = expiry;
        this.id = id;
    }

    public long getExpiry() {
        return expiry;
    }

    public ProofRequestId getId() {
        return id;
    }

    @Override
    public String toString() {
        return "ExpiryEntry{expiry=" + expiry + ", id=" + id + '}';
    }
}
