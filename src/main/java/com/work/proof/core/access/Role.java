package com.work.proof.core.access;

public enum Role {
    ADMIN,
    SUBMITTER
}
