package com.work.proof.core.access;

/**
 * 角色判定端口。角色的授予/回收不在本组件范围内。
 */
public interface AccessControl {

    boolean hasRole(String caller, Role role);
}
