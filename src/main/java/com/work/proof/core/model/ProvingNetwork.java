package com.work.proof.core.model;

/**
 * 两个真实证明网络加一个 NONE 哨兵。NONE 只作为“未指派/未设置”的逃逸值，不能作为地址/状态修改的目标。
 */
public enum ProvingNetwork {
    NONE,
    FERMAH,
    LAGRANGE;

    public boolean isReal() {
        return this != NONE;
    }
}
